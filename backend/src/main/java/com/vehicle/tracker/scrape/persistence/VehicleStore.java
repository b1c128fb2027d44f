package com.vehicle.tracker.scrape.persistence;

import com.vehicle.tracker.scrape.model.CatalogStats;
import com.vehicle.tracker.scrape.model.CatalogVehicle;
import com.vehicle.tracker.scrape.model.VehicleEntity;
import com.vehicle.tracker.scrape.model.VehicleQuery;

import java.time.Instant;
import java.util.List;

/**
 * Durable vehicle catalog keyed by listing URL. Entities are never deleted and price history
 * is append-only.
 */
public interface VehicleStore {

    /**
     * @return the stored entity or {@code null} when the URL has never been seen
     */
    VehicleEntity findByUrl(String url);

    /**
     * Inserts or updates by URL. An existing row keeps its {@code first_seen} and
     * {@code original_price}.
     */
    void upsert(VehicleEntity entity);

    void appendPriceHistory(String url, Long price, Instant observedAt);

    /**
     * Flags every available entity last seen before {@code cutoff} as unavailable.
     *
     * @return number of entities flipped
     */
    int markUnavailableNotSeenSince(Instant cutoff);

    List<CatalogVehicle> queryAll(VehicleQuery query);

    CatalogStats catalogStats(Instant now);
}
