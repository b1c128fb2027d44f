package com.vehicle.tracker.scrape.model;

public enum JobStatus {
    IDLE,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
