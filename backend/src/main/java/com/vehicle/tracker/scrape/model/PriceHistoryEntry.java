package com.vehicle.tracker.scrape.model;

import java.time.Instant;

public record PriceHistoryEntry(String vehicleUrl, Long price, Instant observedAt) {}
