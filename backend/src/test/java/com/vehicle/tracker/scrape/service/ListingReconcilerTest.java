package com.vehicle.tracker.scrape.service;

import com.vehicle.tracker.config.ScraperProperties;
import com.vehicle.tracker.scrape.MutableClock;
import com.vehicle.tracker.scrape.model.PriceHistoryEntry;
import com.vehicle.tracker.scrape.model.ReconcileOutcome;
import com.vehicle.tracker.scrape.model.VehicleEntity;
import com.vehicle.tracker.scrape.model.VehicleRecord;
import com.vehicle.tracker.scrape.persistence.VehicleJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class ListingReconcilerTest {
    private static final Instant T0 = Instant.parse("2032-01-10T09:00:00Z");

    @Autowired
    private VehicleJdbcRepository repository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Autowired
    private ScraperProperties properties;

    private MutableClock clock;
    private ListingReconciler reconciler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        reconciler = new ListingReconciler(repository, transactionManager, properties, clock);
    }

    @Test
    void priceDropThenDisappearance() {
        String url = uniqueUrl();

        ReconcileOutcome first = reconciler.reconcileBatch(List.of(record(url, 2_000_000L))).get(0);
        assertTrue(first.isNew());
        assertThat(repository.findPriceHistory(url)).isEmpty();

        clock.set(T0.plus(Duration.ofDays(1)));
        ReconcileOutcome second = reconciler.reconcileBatch(List.of(record(url, 1_850_000L))).get(0);
        assertFalse(second.isNew());
        assertTrue(second.priceChanged());
        assertEquals(2_000_000L, second.oldPrice());

        VehicleEntity afterDrop = repository.findByUrl(url);
        assertEquals(1_850_000L, afterDrop.currentPrice());
        assertEquals(2_000_000L, afterDrop.originalPrice());
        assertEquals(T0, afterDrop.firstSeen());
        List<PriceHistoryEntry> history = repository.findPriceHistory(url);
        assertThat(history).hasSize(1);
        assertEquals(1_850_000L, history.get(0).price());
        assertEquals(afterDrop.lastSeen(), history.get(0).observedAt());

        Instant thirdRunStart = T0.plus(Duration.ofDays(2));
        clock.set(thirdRunStart);
        reconciler.runAvailabilityPass(thirdRunStart);

        VehicleEntity gone = repository.findByUrl(url);
        assertFalse(gone.available());
        assertEquals(afterDrop.lastSeen(), gone.lastSeen());
        assertThat(repository.findPriceHistory(url)).hasSize(1);
    }

    @Test
    void reconcilingTheSameSnapshotTwiceOnlyAdvancesLastSeen() {
        String url = uniqueUrl();
        VehicleRecord record = record(url, 1_590_000L);

        reconciler.reconcileBatch(List.of(record));
        VehicleEntity first = repository.findByUrl(url);
        ReconcileOutcome again = reconciler.reconcileBatch(List.of(record)).get(0);
        VehicleEntity second = repository.findByUrl(url);

        assertFalse(again.isNew());
        assertFalse(again.priceChanged());
        assertThat(repository.findPriceHistory(url)).isEmpty();
        assertEquals(first.originalPrice(), second.originalPrice());
        assertEquals(first.firstSeen(), second.firstSeen());
        assertThat(second.lastSeen()).isAfter(first.lastSeen());
    }

    @Test
    void historyTimestampsStayStrictlyIncreasingWhenTheClockStalls() {
        String url = uniqueUrl();
        reconciler.reconcileBatch(List.of(record(url, 1_000_000L)));
        reconciler.reconcileBatch(List.of(record(url, 990_000L)));
        reconciler.reconcileBatch(List.of(record(url, 980_000L)));
        reconciler.reconcileBatch(List.of(record(url, 970_000L)));

        List<PriceHistoryEntry> history = repository.findPriceHistory(url);

        assertThat(history).extracting(PriceHistoryEntry::price).containsExactly(990_000L, 980_000L, 970_000L);
        assertThat(history.get(1).observedAt()).isAfter(history.get(0).observedAt());
        assertThat(history.get(2).observedAt()).isAfter(history.get(1).observedAt());
        assertThat(history.get(0).observedAt()).isAfter(repository.findByUrl(url).firstSeen());
    }

    @Test
    void transitionsToAndFromUnknownPriceAreRecorded() {
        String url = uniqueUrl();
        reconciler.reconcileBatch(List.of(record(url, null)));
        clock.advance(Duration.ofHours(1));
        ReconcileOutcome priced = reconciler.reconcileBatch(List.of(record(url, 1_200_000L))).get(0);
        clock.advance(Duration.ofHours(1));
        ReconcileOutcome unpriced = reconciler.reconcileBatch(List.of(record(url, null))).get(0);

        assertTrue(priced.priceChanged());
        assertTrue(unpriced.priceChanged());
        assertThat(repository.findPriceHistory(url)).extracting(PriceHistoryEntry::price).containsExactly(1_200_000L, null);
        assertThat(repository.findByUrl(url).originalPrice()).isNull();
    }

    @Test
    void availabilityPassHonoursGracePeriod() {
        String url = uniqueUrl();
        reconciler.reconcileBatch(List.of(record(url, 1_000_000L)));

        properties.getReconcile().setAvailabilityGraceMinutes(30);
        try {
            reconciler.runAvailabilityPass(T0.plus(Duration.ofMinutes(20)));
            assertTrue(repository.findByUrl(url).available());

            reconciler.runAvailabilityPass(T0.plus(Duration.ofMinutes(40)));
            assertFalse(repository.findByUrl(url).available());
        } finally {
            properties.getReconcile().setAvailabilityGraceMinutes(0);
        }
    }

    @Test
    void seenAgainMakesAVehicleAvailable() {
        String url = uniqueUrl();
        reconciler.reconcileBatch(List.of(record(url, 1_000_000L)));
        reconciler.runAvailabilityPass(T0.plusSeconds(1));
        assertFalse(repository.findByUrl(url).available());

        clock.advance(Duration.ofDays(1));
        reconciler.reconcileBatch(List.of(record(url, 1_000_000L)));

        assertTrue(repository.findByUrl(url).available());
    }

    private static String uniqueUrl() {
        return "https://fr.renew.auto/vehicules/" + UUID.randomUUID() + ".html";
    }

    private static VehicleRecord record(String url, Long price) {
        return new VehicleRecord(url, "Renault Scenic E-Tech", price, "Esprit Alpine", "AC 22 kW", "Bleu", "Cuir", List.of("Pack Tech"), "Nantes", null, null, null);
    }
}
