package com.vehicle.tracker.scrape.model;

import java.time.Instant;
import java.util.List;

public record VehicleEntity(
    String url,
    String title,
    Long currentPrice,
    Long originalPrice,
    String trim,
    String chargeType,
    String exteriorColor,
    String seatType,
    List<String> packs,
    String location,
    Double latitude,
    Double longitude,
    String photoUrl,
    Instant firstSeen,
    Instant lastSeen,
    boolean available
) {
    public VehicleEntity {
        packs = packs == null ? List.of() : List.copyOf(packs);
    }

    public static VehicleEntity firstObservation(VehicleRecord record, Instant observedAt) {
        return new VehicleEntity(
            record.url(),
            record.title(),
            record.price(),
            record.price(),
            record.trim(),
            record.chargeType(),
            record.exteriorColor(),
            record.seatType(),
            record.packs(),
            record.location(),
            record.latitude(),
            record.longitude(),
            record.photoUrl(),
            observedAt,
            observedAt,
            true
        );
    }

    /**
     * Latest observed values replace the stored ones; identity, first sighting and the
     * original price are carried over unchanged.
     */
    public VehicleEntity observedAgain(VehicleRecord record, Instant observedAt) {
        return new VehicleEntity(
            url,
            record.title(),
            record.price(),
            originalPrice,
            record.trim(),
            record.chargeType(),
            record.exteriorColor(),
            record.seatType(),
            record.packs(),
            record.location(),
            record.latitude(),
            record.longitude(),
            record.photoUrl(),
            firstSeen,
            observedAt,
            true
        );
    }
}
