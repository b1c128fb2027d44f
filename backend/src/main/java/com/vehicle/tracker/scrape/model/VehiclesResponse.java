package com.vehicle.tracker.scrape.model;

import java.time.Instant;
import java.util.List;

public record VehiclesResponse(boolean success, List<VehicleView> vehicles, CatalogStats stats, Instant timestamp) {}
