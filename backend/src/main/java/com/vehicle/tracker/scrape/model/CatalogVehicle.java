package com.vehicle.tracker.scrape.model;

import java.util.List;

public record CatalogVehicle(VehicleEntity vehicle, List<PriceHistoryEntry> priceHistory) {
    public CatalogVehicle {
        priceHistory = priceHistory == null ? List.of() : List.copyOf(priceHistory);
    }
}
