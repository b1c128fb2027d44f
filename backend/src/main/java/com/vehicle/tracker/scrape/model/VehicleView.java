package com.vehicle.tracker.scrape.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record VehicleView(
    String url,
    String title,
    Long price,
    Long originalPrice,
    String trim,
    String chargeType,
    String exteriorColor,
    String seatType,
    List<String> packs,
    String location,
    String photoUrl,
    Double latitude,
    Double longitude,
    Instant firstSeen,
    Instant lastSeen,
    boolean isAvailable,
    boolean isNew,
    List<PricePoint> priceHistory
) {}
