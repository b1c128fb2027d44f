package com.vehicle.tracker.scrape.model;

import java.time.Instant;

/**
 * Immutable view of the scrape job. Every transition produces a new instance.
 *
 * @param generation increments on every accepted start; progress from an older run is ignored
 * @param lastRunAt  finish time of the most recent run that reached {@link JobStatus#COMPLETED}
 */
public record JobState(
    long generation,
    JobStatus status,
    int progress,
    String message,
    Instant startedAt,
    Instant finishedAt,
    String error,
    Instant lastRunAt,
    RunCounters counters
) {
    public JobState {
        progress = Math.max(0, Math.min(100, progress));
        counters = counters == null ? RunCounters.ZERO : counters;
    }

    public static JobState idle(long generation, Instant lastRunAt) {
        return new JobState(generation, JobStatus.IDLE, 0, "Ready", null, null, null, lastRunAt, RunCounters.ZERO);
    }

    public boolean isRunning() {
        return status == JobStatus.RUNNING;
    }

    public JobState withProgress(int newProgress, String newMessage, RunCounters newCounters) {
        return new JobState(
            generation,
            status,
            newProgress,
            newMessage == null ? message : newMessage,
            startedAt,
            finishedAt,
            error,
            lastRunAt,
            newCounters == null ? counters : newCounters
        );
    }
}
