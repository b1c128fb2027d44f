package com.vehicle.tracker.scrape.extract;

/**
 * Counts consecutive growth steps that did not increase the number of distinct listings.
 * The page is settled once that count reaches the threshold.
 */
public final class SettleTracker {
    private final int threshold;
    private int lastCount;
    private int consecutiveNoGrowth;

    public SettleTracker(int threshold, int initialCount) {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be >= 1");
        }
        this.threshold = threshold;
        this.lastCount = initialCount;
    }

    public boolean observe(int distinctCount) {
        if (distinctCount > lastCount) {
            lastCount = distinctCount;
            consecutiveNoGrowth = 0;
        } else {
            consecutiveNoGrowth++;
        }
        return isSettled();
    }

    public boolean isSettled() {
        return consecutiveNoGrowth >= threshold;
    }

    public int consecutiveNoGrowth() {
        return consecutiveNoGrowth;
    }

    public int lastCount() {
        return lastCount;
    }
}
