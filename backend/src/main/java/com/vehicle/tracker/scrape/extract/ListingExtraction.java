package com.vehicle.tracker.scrape.extract;

import com.vehicle.tracker.scrape.model.VehicleRecord;
import com.vehicle.tracker.scrape.service.RunCancellation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * One pass over a growing listing page. Records are produced lazily: the page only grows when
 * the records found so far have been consumed. Single use.
 */
public class ListingExtraction implements Iterator<VehicleRecord> {
    private static final Logger log = LoggerFactory.getLogger(ListingExtraction.class);

    private final ListingPage page;
    private final ListingCardParser parser;
    private final VehicleListingFilter filter;
    private final RunCancellation cancellation;
    private final int settleThreshold;
    private final Duration growthTimeout;
    private final int maxGrowthSteps;

    private final Set<String> seenUrls = new HashSet<>();
    private final Deque<VehicleRecord> pending = new ArrayDeque<>();
    private SettleTracker settleTracker;
    private boolean finished;
    private String stopReason;
    private int growthSteps;
    private int timeouts;
    private int filtered;

    ListingExtraction(
        ListingPage page,
        ListingCardParser parser,
        VehicleListingFilter filter,
        RunCancellation cancellation,
        int settleThreshold,
        Duration growthTimeout,
        int maxGrowthSteps
    ) {
        this.page = page;
        this.parser = parser;
        this.filter = filter;
        this.cancellation = cancellation;
        this.settleThreshold = settleThreshold;
        this.growthTimeout = growthTimeout;
        this.maxGrowthSteps = maxGrowthSteps;
    }

    @Override
    public boolean hasNext() {
        while (pending.isEmpty() && !finished) {
            advance();
        }
        return !pending.isEmpty();
    }

    @Override
    public VehicleRecord next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Extraction finished: " + stopReason);
        }
        return pending.poll();
    }

    private void advance() {
        if (settleTracker == null) {
            harvest();
            settleTracker = new SettleTracker(settleThreshold, seenUrls.size());
            return;
        }
        if (growthSteps >= maxGrowthSteps) {
            finish("max_growth_steps");
            return;
        }
        cancellation.checkpoint("before growth step " + (growthSteps + 1));

        GrowthOutcome outcome = page.grow(growthTimeout);
        growthSteps++;
        if (outcome == GrowthOutcome.EXHAUSTED) {
            finish("source_exhausted");
            return;
        }
        if (outcome == GrowthOutcome.TIMED_OUT) {
            timeouts++;
        }
        harvest();
        if (settleTracker.observe(seenUrls.size())) {
            finish("settled");
        }
    }

    private void harvest() {
        for (ListingCard card : parser.parse(page.content(), page.baseUri())) {
            if (!seenUrls.add(card.record().url())) {
                continue;
            }
            if (filter.accepts(card)) {
                pending.add(card.record());
            } else {
                filtered++;
            }
        }
    }

    private void finish(String reason) {
        finished = true;
        stopReason = reason;
        log.info(
            "Extraction finished ({}): listings={} filtered={} growthSteps={} timeouts={} pages={}",
            reason,
            seenUrls.size(),
            filtered,
            growthSteps,
            timeouts,
            page.pagesLoaded()
        );
    }

    public String stopReason() {
        return stopReason;
    }

    public int growthSteps() {
        return growthSteps;
    }

    public int timeouts() {
        return timeouts;
    }

    public int distinctListings() {
        return seenUrls.size();
    }

    public int filteredListings() {
        return filtered;
    }

    public int pagesLoaded() {
        return page.pagesLoaded();
    }
}
