package com.vehicle.tracker.scrape.model;

public record VehicleQuery(Boolean available) {
    public static VehicleQuery all() {
        return new VehicleQuery(null);
    }
}
