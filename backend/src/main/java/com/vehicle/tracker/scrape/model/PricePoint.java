package com.vehicle.tracker.scrape.model;

import java.time.Instant;

public record PricePoint(Long price, Instant date) {}
