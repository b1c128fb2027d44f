package com.vehicle.tracker.scrape.service;

import com.vehicle.tracker.scrape.model.RunCounters;

@FunctionalInterface
public interface ScrapeProgressListener {
    void onProgress(long generation, int progress, String message, RunCounters counters);
}
