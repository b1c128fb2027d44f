package com.vehicle.tracker.scrape.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StatusResponse(
    boolean success,
    JobStatus status,
    boolean isRunning,
    int progress,
    String statusMessage,
    Instant lastRun,
    Instant startedAt,
    Instant finishedAt,
    String error,
    int pagesProcessed,
    int adsProcessed,
    int adsAdded,
    int priceChanges
) {
    public static StatusResponse from(JobState state) {
        RunCounters counters = state.counters();
        return new StatusResponse(
            true,
            state.status(),
            state.isRunning(),
            state.progress(),
            state.message(),
            state.lastRunAt(),
            state.startedAt(),
            state.finishedAt(),
            state.error(),
            counters.pagesLoaded(),
            counters.listingsProcessed(),
            counters.listingsAdded(),
            counters.priceChanges()
        );
    }
}
