package com.vehicle.tracker.scrape.service;

import com.vehicle.tracker.scrape.model.CatalogStats;
import com.vehicle.tracker.scrape.model.CatalogVehicle;
import com.vehicle.tracker.scrape.model.PriceHistoryEntry;
import com.vehicle.tracker.scrape.model.PricePoint;
import com.vehicle.tracker.scrape.model.VehicleEntity;
import com.vehicle.tracker.scrape.model.VehicleQuery;
import com.vehicle.tracker.scrape.model.VehicleView;
import com.vehicle.tracker.scrape.model.VehiclesResponse;
import com.vehicle.tracker.scrape.persistence.VehicleStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Service
public class VehicleCatalogService {
    private static final Duration NEW_WINDOW = Duration.ofHours(24);

    private final VehicleStore store;
    private final Clock clock;

    public VehicleCatalogService(VehicleStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public VehiclesResponse listVehicles(Boolean available) {
        Instant now = clock.instant();
        List<CatalogVehicle> catalog = store.queryAll(new VehicleQuery(available));
        List<VehicleView> views = new ArrayList<>(catalog.size());
        for (CatalogVehicle item : catalog) {
            views.add(toView(item, now));
        }
        return new VehiclesResponse(true, views, store.catalogStats(now), now);
    }

    public CatalogStats stats() {
        return store.catalogStats(clock.instant());
    }

    private VehicleView toView(CatalogVehicle item, Instant now) {
        VehicleEntity vehicle = item.vehicle();
        List<PricePoint> history = new ArrayList<>(item.priceHistory().size());
        for (PriceHistoryEntry entry : item.priceHistory()) {
            history.add(new PricePoint(entry.price(), entry.observedAt()));
        }
        boolean isNew = vehicle.available()
            && vehicle.firstSeen() != null
            && !vehicle.firstSeen().isBefore(now.minus(NEW_WINDOW));
        return new VehicleView(
            vehicle.url(),
            vehicle.title(),
            vehicle.currentPrice(),
            vehicle.originalPrice(),
            vehicle.trim(),
            vehicle.chargeType(),
            vehicle.exteriorColor(),
            vehicle.seatType(),
            vehicle.packs(),
            vehicle.location(),
            vehicle.photoUrl(),
            vehicle.latitude(),
            vehicle.longitude(),
            vehicle.firstSeen(),
            vehicle.lastSeen(),
            vehicle.available(),
            isNew,
            history
        );
    }
}
