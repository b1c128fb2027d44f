package com.vehicle.tracker.scrape.service;

public class ScrapeCancelledException extends RuntimeException {
    public ScrapeCancelledException(String message) {
        super(message);
    }
}
