package com.vehicle.tracker.scrape.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CatalogStats(long total, long available, long newIn24h, long withPriceHistory) {}
