package com.vehicle.tracker.scrape.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for one run. Workers poll it at checkpoints only.
 */
public class RunCancellation {
    private final AtomicBoolean requested = new AtomicBoolean(false);

    public static RunCancellation none() {
        return new RunCancellation();
    }

    public void request() {
        requested.set(true);
    }

    public boolean isRequested() {
        return requested.get();
    }

    public void checkpoint(String stage) {
        if (requested.get()) {
            throw new ScrapeCancelledException("Cancelled " + stage);
        }
    }
}
