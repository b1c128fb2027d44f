package com.vehicle.tracker.scrape.extract;

import com.vehicle.tracker.scrape.model.VehicleRecord;

public record ListingCard(VehicleRecord record, String text) {}
