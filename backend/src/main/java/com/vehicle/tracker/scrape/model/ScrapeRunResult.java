package com.vehicle.tracker.scrape.model;

public record ScrapeRunResult(long scrapeRunId, RunCounters counters, String stopReason, int markedUnavailable) {}
