package com.vehicle.tracker.scrape.service;

import com.vehicle.tracker.scrape.model.JobState;
import com.vehicle.tracker.scrape.model.JobStatus;
import com.vehicle.tracker.scrape.model.RunCounters;
import com.vehicle.tracker.scrape.model.ScrapeRunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Owns the scrape job state machine: IDLE, RUNNING, then COMPLETED, FAILED or CANCELLED
 * until acknowledged or restarted. At most one run is active. Every transition happens under
 * {@link #lock}; readers see the latest immutable {@link JobState} without locking.
 */
@Service
public class ScrapeJobController {
    private static final Logger log = LoggerFactory.getLogger(ScrapeJobController.class);
    static final String ALREADY_RUNNING = "already running";

    private final Object lock = new Object();
    private final ScrapeRunService runService;
    private final ExecutorService scrapeRunExecutor;
    private final Clock clock;

    private volatile JobState state = JobState.idle(0, null);
    private RunCancellation cancellation = RunCancellation.none();

    public ScrapeJobController(
        ScrapeRunService runService,
        @Qualifier("scrapeRunExecutor") ExecutorService scrapeRunExecutor,
        Clock clock
    ) {
        this.runService = runService;
        this.scrapeRunExecutor = scrapeRunExecutor;
        this.clock = clock;
    }

    /**
     * Starts a run in the background.
     *
     * @throws ActiveScrapeRunException when a run is already active
     */
    public JobState start() {
        synchronized (lock) {
            JobState current = state;
            if (current.isRunning()) {
                throw new ActiveScrapeRunException(ALREADY_RUNNING);
            }
            long generation = current.generation() + 1;
            Instant startedAt = clock.instant();
            RunCancellation runCancellation = new RunCancellation();
            ScrapeRunContext context = new ScrapeRunContext(generation, startedAt, runCancellation, this::reportProgress);

            cancellation = runCancellation;
            state = new JobState(
                generation,
                JobStatus.RUNNING,
                5,
                "Starting scrape...",
                startedAt,
                null,
                null,
                current.lastRunAt(),
                RunCounters.ZERO
            );
            try {
                scrapeRunExecutor.submit(() -> runGeneration(context));
            } catch (RejectedExecutionException e) {
                log.warn("Scrape run executor rejected generation {}", generation, e);
                state = new JobState(
                    generation,
                    JobStatus.FAILED,
                    0,
                    "Scrape could not be scheduled",
                    startedAt,
                    clock.instant(),
                    "executor_rejected",
                    current.lastRunAt(),
                    RunCounters.ZERO
                );
                throw e;
            }
            log.info("Scrape generation {} accepted", generation);
            return state;
        }
    }

    /**
     * Requests cooperative cancellation of the active run.
     *
     * @return whether a run was active
     */
    public boolean cancel() {
        synchronized (lock) {
            JobState current = state;
            if (!current.isRunning()) {
                return false;
            }
            cancellation.request();
            state = current.withProgress(current.progress(), "Cancelling...", null);
            log.info("Cancellation requested for scrape generation {}", current.generation());
            return true;
        }
    }

    /**
     * Clears a terminal state back to IDLE. No effect while idle or running.
     */
    public JobState acknowledge() {
        synchronized (lock) {
            JobState current = state;
            if (current.status().isTerminal()) {
                state = JobState.idle(current.generation(), current.lastRunAt());
            }
            return state;
        }
    }

    public void reportProgress(long generation, int progress, String message, RunCounters counters) {
        synchronized (lock) {
            JobState current = state;
            if (!current.isRunning() || current.generation() != generation) {
                return;
            }
            state = current.withProgress(progress, message, counters);
        }
    }

    public JobState snapshot() {
        return state;
    }

    /**
     * Seeds the last successful run time from the ledger at startup.
     */
    public void restoreLastRunAt(Instant lastRunAt) {
        synchronized (lock) {
            JobState current = state;
            if (lastRunAt == null || current.lastRunAt() != null || current.status() != JobStatus.IDLE) {
                return;
            }
            state = JobState.idle(current.generation(), lastRunAt);
        }
    }

    private void runGeneration(ScrapeRunContext context) {
        try {
            ScrapeRunResult result = runService.execute(context);
            RunCounters counters = result.counters();
            finish(
                context.generation(),
                JobStatus.COMPLETED,
                "Completed: " + counters.listingsProcessed() + " listings, "
                    + counters.listingsAdded() + " new, "
                    + counters.priceChanges() + " price changes",
                null,
                counters
            );
        } catch (ScrapeCancelledException e) {
            finish(context.generation(), JobStatus.CANCELLED, "Cancelled by user (" + e.getMessage() + ")", null, null);
        } catch (Exception e) {
            log.warn("Scrape generation {} failed", context.generation(), e);
            finish(context.generation(), JobStatus.FAILED, "Scrape failed", describe(e), null);
        } catch (Error e) {
            log.error("Scrape generation {} failed with an error", context.generation(), e);
            finish(context.generation(), JobStatus.FAILED, "Scrape failed", describe(e), null);
            throw e;
        }
    }

    private void finish(long generation, JobStatus status, String message, String error, RunCounters counters) {
        synchronized (lock) {
            JobState current = state;
            if (!current.isRunning() || current.generation() != generation) {
                return;
            }
            Instant finishedAt = clock.instant();
            state = new JobState(
                generation,
                status,
                status == JobStatus.COMPLETED ? 100 : current.progress(),
                message,
                current.startedAt(),
                finishedAt,
                error,
                status == JobStatus.COMPLETED ? finishedAt : current.lastRunAt(),
                counters == null ? current.counters() : counters
            );
        }
        log.info("Scrape generation {} finished with status {}", generation, status);
    }

    private String describe(Throwable e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            return e.getClass().getSimpleName();
        }
        return e.getClass().getSimpleName() + ": " + message;
    }
}
