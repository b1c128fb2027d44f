package com.vehicle.tracker.scrape.service;

import com.vehicle.tracker.scrape.model.RunCounters;
import com.vehicle.tracker.scrape.model.ScrapeRunMeta;
import com.vehicle.tracker.scrape.persistence.ScrapeRunJdbcRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class ScrapeRunLifecycleRunnerTest {

    @Autowired
    private ScrapeRunLifecycleRunner runner;

    @Autowired
    private ScrapeRunJdbcRepository runRepository;

    @Test
    void abortsRunsWithStaleHeartbeatAndLeavesLiveOnes() {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        long staleId = runRepository.insertScrapeRun(now.minus(Duration.ofHours(5)), "RUNNING", "test");
        runRepository.updateScrapeRunProgress(staleId, new RunCounters(2, 20, 3, 1), now.minus(Duration.ofHours(4)));
        long liveId = runRepository.insertScrapeRun(now.minus(Duration.ofHours(3)), "RUNNING", "test");
        runRepository.updateScrapeRunHeartbeat(liveId, now.minus(Duration.ofMinutes(1)));

        runner.run(new DefaultApplicationArguments());

        ScrapeRunMeta stale = runRepository.findScrapeRunById(staleId);
        assertEquals("ABORTED", stale.status());
        assertNotNull(stale.finishedAt());
        assertEquals(20, stale.counters().listingsProcessed());
        assertEquals("RUNNING", runRepository.findScrapeRunById(liveId).status());
    }

    @Test
    void ledgerReturnsMostRecentCompletedRun() {
        Instant base = Instant.parse("2033-01-01T00:00:00Z");
        long older = runRepository.insertScrapeRun(base, "RUNNING", "test");
        runRepository.completeScrapeRun(older, base.plusSeconds(60), "COMPLETED", "ok", RunCounters.ZERO);
        long newer = runRepository.insertScrapeRun(base.plusSeconds(120), "RUNNING", "test");
        runRepository.completeScrapeRun(newer, base.plusSeconds(180), "COMPLETED", "ok", new RunCounters(1, 5, 5, 0));
        long failed = runRepository.insertScrapeRun(base.plusSeconds(240), "RUNNING", "test");
        runRepository.completeScrapeRun(failed, base.plusSeconds(300), "FAILED", "boom", RunCounters.ZERO);

        ScrapeRunMeta latest = runRepository.findMostRecentCompletedScrapeRun();

        assertEquals(newer, latest.scrapeRunId());
        assertEquals(base.plusSeconds(180), latest.finishedAt());
        assertEquals(5, latest.counters().listingsAdded());
    }
}
