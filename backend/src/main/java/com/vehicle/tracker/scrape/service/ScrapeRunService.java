package com.vehicle.tracker.scrape.service;

import com.vehicle.tracker.config.ScraperProperties;
import com.vehicle.tracker.scrape.extract.ListingExtraction;
import com.vehicle.tracker.scrape.extract.ListingExtractor;
import com.vehicle.tracker.scrape.extract.ListingPage;
import com.vehicle.tracker.scrape.extract.ListingSource;
import com.vehicle.tracker.scrape.extract.ListingStructureException;
import com.vehicle.tracker.scrape.model.ReconcileOutcome;
import com.vehicle.tracker.scrape.model.RunCounters;
import com.vehicle.tracker.scrape.model.ScrapeRunResult;
import com.vehicle.tracker.scrape.model.VehicleRecord;
import com.vehicle.tracker.scrape.persistence.ScrapeRunJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Body of one scrape run: open the source, stream extracted listings into the reconciler
 * batch by batch, then run the availability pass. Terminal status is written to the run
 * ledger whatever happens; the failure itself is rethrown to the caller.
 */
@Service
public class ScrapeRunService {
    private static final Logger log = LoggerFactory.getLogger(ScrapeRunService.class);
    private static final int MAX_NOTES_LENGTH = 2000;

    private final ListingSource listingSource;
    private final ListingExtractor extractor;
    private final ListingReconciler reconciler;
    private final ScrapeRunJdbcRepository runRepository;
    private final DiagnosticSnapshotWriter snapshotWriter;
    private final ScraperProperties properties;
    private final Clock clock;

    public ScrapeRunService(
        ListingSource listingSource,
        ListingExtractor extractor,
        ListingReconciler reconciler,
        ScrapeRunJdbcRepository runRepository,
        DiagnosticSnapshotWriter snapshotWriter,
        ScraperProperties properties,
        Clock clock
    ) {
        this.listingSource = listingSource;
        this.extractor = extractor;
        this.reconciler = reconciler;
        this.runRepository = runRepository;
        this.snapshotWriter = snapshotWriter;
        this.properties = properties;
        this.clock = clock;
    }

    public ScrapeRunResult execute(ScrapeRunContext context) {
        long scrapeRunId = runRepository.insertScrapeRun(context.startedAt(), "RUNNING", "scrape started");
        log.info("Scrape run {} started (generation {})", scrapeRunId, context.generation());

        ScheduledExecutorService heartbeat = Executors.newSingleThreadScheduledExecutor();
        heartbeat.scheduleAtFixedRate(
            () -> {
                try {
                    runRepository.updateScrapeRunHeartbeat(scrapeRunId, clock.instant());
                } catch (Exception e) {
                    log.debug("Heartbeat update failed for scrape run {}", scrapeRunId, e);
                }
            },
            properties.getRun().getHeartbeatSeconds(),
            properties.getRun().getHeartbeatSeconds(),
            TimeUnit.SECONDS
        );

        String status = "FAILED";
        String notes = "scrape_failed";
        RunProgress progress = new RunProgress(context);
        try (ListingPage page = listingSource.open()) {
            progress.counters = progress.counters.withPagesLoaded(page.pagesLoaded());
            context.report(10, progress.message(), progress.counters);

            ListingExtraction extraction = extractor.extract(page, context.cancellation());
            int batchSize = properties.getReconcile().getBatchSize();
            List<VehicleRecord> batch = new ArrayList<>(batchSize);
            while (extraction.hasNext()) {
                batch.add(extraction.next());
                if (batch.size() >= batchSize) {
                    flush(batch, extraction, progress, scrapeRunId);
                }
            }
            flush(batch, extraction, progress, scrapeRunId);

            context.cancellation().checkpoint("before availability pass");
            context.report(95, "Updating availability...", progress.counters);
            int unavailable = reconciler.runAvailabilityPass(context.startedAt());

            status = "COMPLETED";
            notes = "stop=" + extraction.stopReason()
                + " timeouts=" + extraction.timeouts()
                + " filtered=" + extraction.filteredListings()
                + " unavailable=" + unavailable;
            log.info(
                "Scrape run {} completed: pages={} listings={} new={} priceChanges={} unavailable={}",
                scrapeRunId,
                progress.counters.pagesLoaded(),
                progress.counters.listingsProcessed(),
                progress.counters.listingsAdded(),
                progress.counters.priceChanges(),
                unavailable
            );
            return new ScrapeRunResult(scrapeRunId, progress.counters, extraction.stopReason(), unavailable);
        } catch (ScrapeCancelledException e) {
            log.info("Scrape run {} cancelled: {}", scrapeRunId, e.getMessage());
            status = "CANCELLED";
            notes = e.getMessage();
            throw e;
        } catch (ListingStructureException e) {
            log.warn("Scrape run {} failed on unexpected page structure: {}", scrapeRunId, e.getMessage());
            snapshotWriter.write(e.getRawContent());
            notes = "structure_error: " + e.getMessage();
            throw e;
        } catch (RuntimeException e) {
            log.warn("Scrape run {} failed", scrapeRunId, e);
            notes = "exception=" + e.getClass().getSimpleName() + ": " + e.getMessage();
            throw e;
        } finally {
            heartbeat.shutdownNow();
            try {
                runRepository.completeScrapeRun(scrapeRunId, clock.instant(), status, truncate(notes), progress.counters);
            } catch (RuntimeException e) {
                log.warn("Unable to record terminal status {} for scrape run {}", status, scrapeRunId, e);
            }
        }
    }

    private void flush(List<VehicleRecord> batch, ListingExtraction extraction, RunProgress progress, long scrapeRunId) {
        if (batch.isEmpty()) {
            return;
        }
        progress.context.cancellation().checkpoint("before store batch");
        List<ReconcileOutcome> outcomes = reconciler.reconcileBatch(batch);
        batch.clear();

        RunCounters counters = progress.counters;
        for (ReconcileOutcome outcome : outcomes) {
            counters = counters.plus(outcome);
        }
        progress.counters = counters.withPagesLoaded(extraction.pagesLoaded());
        runRepository.updateScrapeRunProgress(scrapeRunId, progress.counters, clock.instant());

        int maxPages = properties.getSource().getMaxPages();
        int percent = 10 + (int) (80L * Math.min(extraction.growthSteps(), maxPages) / maxPages);
        progress.context.report(Math.min(90, percent), progress.message(), progress.counters);
    }

    private String truncate(String notes) {
        if (notes == null || notes.length() <= MAX_NOTES_LENGTH) {
            return notes;
        }
        return notes.substring(0, MAX_NOTES_LENGTH);
    }

    private static final class RunProgress {
        private final ScrapeRunContext context;
        private RunCounters counters = RunCounters.ZERO;

        private RunProgress(ScrapeRunContext context) {
            this.context = context;
        }

        private String message() {
            return "Scraping... Page " + counters.pagesLoaded()
                + " | Listings: " + counters.listingsProcessed()
                + " | New: " + counters.listingsAdded();
        }
    }
}
