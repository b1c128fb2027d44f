package com.vehicle.tracker.scrape.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScrapeRunMeta(
    long scrapeRunId,
    Instant startedAt,
    Instant finishedAt,
    String status,
    String notes,
    RunCounters counters,
    Instant lastHeartbeatAt
) {}
