package com.vehicle.tracker.scrape.service;

import com.vehicle.tracker.scrape.model.RunCounters;

import java.time.Instant;

/**
 * Everything a single run needs from the job that started it.
 */
public record ScrapeRunContext(
    long generation,
    Instant startedAt,
    RunCancellation cancellation,
    ScrapeProgressListener listener
) {
    public void report(int progress, String message, RunCounters counters) {
        if (listener != null) {
            listener.onProgress(generation, progress, message, counters);
        }
    }
}
