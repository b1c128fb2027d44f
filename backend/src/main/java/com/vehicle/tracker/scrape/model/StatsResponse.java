package com.vehicle.tracker.scrape.model;

public record StatsResponse(boolean success, CatalogStats stats) {}
