package com.vehicle.tracker.scrape.model;

import java.util.List;

public record VehicleRecord(
    String url,
    String title,
    Long price,
    String trim,
    String chargeType,
    String exteriorColor,
    String seatType,
    List<String> packs,
    String location,
    Double latitude,
    Double longitude,
    String photoUrl
) {
    public VehicleRecord {
        packs = packs == null ? List.of() : List.copyOf(packs);
    }
}
