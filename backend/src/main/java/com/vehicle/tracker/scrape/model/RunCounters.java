package com.vehicle.tracker.scrape.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RunCounters(int pagesLoaded, int listingsProcessed, int listingsAdded, int priceChanges) {
    public static final RunCounters ZERO = new RunCounters(0, 0, 0, 0);

    public RunCounters withPagesLoaded(int pages) {
        return new RunCounters(pages, listingsProcessed, listingsAdded, priceChanges);
    }

    public RunCounters plus(ReconcileOutcome outcome) {
        return new RunCounters(
            pagesLoaded,
            listingsProcessed + 1,
            listingsAdded + (outcome.isNew() ? 1 : 0),
            priceChanges + (outcome.priceChanged() ? 1 : 0)
        );
    }
}
