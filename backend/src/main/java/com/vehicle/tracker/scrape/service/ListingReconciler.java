package com.vehicle.tracker.scrape.service;

import com.vehicle.tracker.config.ScraperProperties;
import com.vehicle.tracker.scrape.model.ReconcileOutcome;
import com.vehicle.tracker.scrape.model.VehicleEntity;
import com.vehicle.tracker.scrape.model.VehicleRecord;
import com.vehicle.tracker.scrape.persistence.VehicleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Merges extracted listings into the store. One transaction per batch; a failed batch is
 * rolled back and retried on its own while earlier batches stay committed.
 */
@Service
public class ListingReconciler {
    private static final Logger log = LoggerFactory.getLogger(ListingReconciler.class);

    private final VehicleStore store;
    private final TransactionTemplate transactionTemplate;
    private final ScraperProperties properties;
    private final Clock clock;

    public ListingReconciler(
        VehicleStore store,
        PlatformTransactionManager transactionManager,
        ScraperProperties properties,
        Clock clock
    ) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout(properties.getReconcile().getTransactionTimeoutSeconds());
    }

    /**
     * Applies one observation. Callers own the transaction.
     */
    public ReconcileOutcome reconcile(VehicleRecord record) {
        Instant now = clock.instant();
        VehicleEntity existing = store.findByUrl(record.url());
        if (existing == null) {
            store.upsert(VehicleEntity.firstObservation(record, now));
            return ReconcileOutcome.inserted(record.url(), record.price());
        }

        Instant observedAt = strictlyAfter(existing.lastSeen(), now);
        Long oldPrice = existing.currentPrice();
        boolean priceChanged = !Objects.equals(oldPrice, record.price());
        if (priceChanged) {
            store.appendPriceHistory(record.url(), record.price(), observedAt);
        }
        store.upsert(existing.observedAgain(record, observedAt));
        return priceChanged
            ? ReconcileOutcome.priceChanged(record.url(), oldPrice, record.price())
            : ReconcileOutcome.unchanged(record.url(), record.price());
    }

    public List<ReconcileOutcome> reconcileBatch(List<VehicleRecord> records) {
        if (records == null || records.isEmpty()) {
            return List.of();
        }
        List<VehicleRecord> batch = List.copyOf(records);
        ScraperProperties.Reconcile config = properties.getReconcile();
        int maxAttempts = config.getStoreMaxAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                return transactionTemplate.execute(status -> {
                    List<ReconcileOutcome> outcomes = new ArrayList<>(batch.size());
                    for (VehicleRecord record : batch) {
                        outcomes.add(reconcile(record));
                    }
                    return outcomes;
                });
            } catch (DataAccessException | TransactionException e) {
                if (attempt >= maxAttempts) {
                    log.warn("Store batch of {} listings failed after {} attempts", batch.size(), attempt, e);
                    throw e;
                }
                log.warn(
                    "Store batch of {} listings failed (attempt {}/{}): {}",
                    batch.size(),
                    attempt,
                    maxAttempts,
                    e.getMessage()
                );
                sleepBeforeRetry(config.getStoreRetryDelayMs() * (long) attempt, e);
            }
        }
    }

    /**
     * Flags every listing not seen since the run started (minus the grace period) as
     * unavailable. Only called for a completed run.
     */
    public int runAvailabilityPass(Instant runStartedAt) {
        Instant cutoff = runStartedAt.minus(Duration.ofMinutes(properties.getReconcile().getAvailabilityGraceMinutes()));
        Integer flipped = transactionTemplate.execute(status -> store.markUnavailableNotSeenSince(cutoff));
        int count = flipped == null ? 0 : flipped;
        log.info("Availability pass marked {} listings unavailable (last seen before {})", count, cutoff);
        return count;
    }

    private Instant strictlyAfter(Instant previous, Instant now) {
        if (previous == null) {
            return now;
        }
        Instant floor = previous.plusMillis(1);
        return now.isBefore(floor) ? floor : now;
    }

    private void sleepBeforeRetry(long delayMs, RuntimeException cause) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cause;
        }
    }
}
