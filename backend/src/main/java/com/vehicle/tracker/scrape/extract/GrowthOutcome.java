package com.vehicle.tracker.scrape.extract;

public enum GrowthOutcome {
    GREW,
    NO_NEW_CONTENT,
    TIMED_OUT,
    EXHAUSTED
}
