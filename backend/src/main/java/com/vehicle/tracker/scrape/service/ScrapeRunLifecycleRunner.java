package com.vehicle.tracker.scrape.service;

import com.vehicle.tracker.config.ScraperProperties;
import com.vehicle.tracker.scrape.model.ScrapeRunMeta;
import com.vehicle.tracker.scrape.persistence.ScrapeRunJdbcRepository;
import com.vehicle.tracker.scrape.persistence.VehicleJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Closes ledger rows left RUNNING by a previous process and restores the last successful
 * run time into the job state.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ScrapeRunLifecycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScrapeRunLifecycleRunner.class);

    private final VehicleJdbcRepository vehicleRepository;
    private final ScrapeRunJdbcRepository runRepository;
    private final ScrapeJobController jobController;
    private final ScraperProperties properties;
    private final Clock clock;

    public ScrapeRunLifecycleRunner(
        VehicleJdbcRepository vehicleRepository,
        ScrapeRunJdbcRepository runRepository,
        ScrapeJobController jobController,
        ScraperProperties properties,
        Clock clock
    ) {
        this.vehicleRepository = vehicleRepository;
        this.runRepository = runRepository;
        this.jobController = jobController;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean dbConnected;
        try {
            dbConnected = vehicleRepository.isDbReachable();
        } catch (Exception e) {
            log.warn("Database connectivity check failed", e);
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping scrape run cleanup because database is unreachable");
            return;
        }

        Instant now = clock.instant();
        Instant cutoff = now.minus(Duration.ofMinutes(properties.getRun().getStaleRunMinutes()));
        List<ScrapeRunMeta> running = runRepository.findRunningScrapeRuns();
        for (ScrapeRunMeta run : running) {
            Instant lastActivity = run.lastHeartbeatAt() == null ? run.startedAt() : run.lastHeartbeatAt();
            if (lastActivity != null && lastActivity.isAfter(cutoff)) {
                continue;
            }
            runRepository.completeScrapeRun(
                run.scrapeRunId(),
                now,
                "ABORTED",
                "aborted_on_startup_stale_heartbeat",
                run.counters()
            );
            log.info("Aborted stale scrape run {} startedAt={} lastHeartbeatAt={}", run.scrapeRunId(), run.startedAt(), run.lastHeartbeatAt());
        }

        ScrapeRunMeta lastCompleted = runRepository.findMostRecentCompletedScrapeRun();
        if (lastCompleted != null) {
            jobController.restoreLastRunAt(lastCompleted.finishedAt());
        }
    }
}
