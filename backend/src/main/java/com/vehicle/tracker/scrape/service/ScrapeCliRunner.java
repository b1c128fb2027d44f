package com.vehicle.tracker.scrape.service;

import com.vehicle.tracker.config.ScraperProperties;
import com.vehicle.tracker.scrape.model.CatalogStats;
import com.vehicle.tracker.scrape.model.JobState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Command-line entry: {@code scraper.cli.run=true} performs one scrape and waits for it,
 * {@code scraper.cli.stats=true} logs the catalog statistics.
 */
@Component
public class ScrapeCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScrapeCliRunner.class);

    private final ScraperProperties properties;
    private final ScrapeJobController jobController;
    private final VehicleCatalogService catalogService;
    private final ConfigurableApplicationContext applicationContext;

    public ScrapeCliRunner(
        ScraperProperties properties,
        ScrapeJobController jobController,
        VehicleCatalogService catalogService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.jobController = jobController;
        this.catalogService = catalogService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) throws InterruptedException {
        ScraperProperties.Cli cli = properties.getCli();
        if (!cli.isRun() && !cli.isStats()) {
            return;
        }

        int exitCode = 0;
        if (cli.isRun()) {
            JobState finalState = runToCompletion(cli.getPollIntervalMs());
            log.info(
                "Scrape finished with status {}: {} (pages={}, listings={}, new={}, priceChanges={})",
                finalState.status(),
                finalState.message(),
                finalState.counters().pagesLoaded(),
                finalState.counters().listingsProcessed(),
                finalState.counters().listingsAdded(),
                finalState.counters().priceChanges()
            );
            if (finalState.error() != null) {
                log.warn("Scrape error: {}", finalState.error());
                exitCode = 1;
            }
        }
        if (cli.isStats()) {
            CatalogStats stats = catalogService.stats();
            log.info(
                "Catalog: total={} available={} newIn24h={} withPriceHistory={}",
                stats.total(),
                stats.available(),
                stats.newIn24h(),
                stats.withPriceHistory()
            );
        }

        if (cli.isExitAfterRun()) {
            int code = exitCode;
            int status = SpringApplication.exit(applicationContext, () -> code);
            System.exit(status);
        }
    }

    private JobState runToCompletion(int pollIntervalMs) throws InterruptedException {
        JobState started = jobController.start();
        JobState current = jobController.snapshot();
        while (current.generation() == started.generation() && current.isRunning()) {
            Thread.sleep(pollIntervalMs);
            current = jobController.snapshot();
        }
        return current;
    }
}
