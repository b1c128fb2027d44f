package com.vehicle.tracker.scrape.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vehicle.tracker.scrape.model.CatalogStats;
import com.vehicle.tracker.scrape.model.CatalogVehicle;
import com.vehicle.tracker.scrape.model.PriceHistoryEntry;
import com.vehicle.tracker.scrape.model.VehicleEntity;
import com.vehicle.tracker.scrape.model.VehicleQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Repository
public class VehicleJdbcRepository implements VehicleStore {
    private static final Logger log = LoggerFactory.getLogger(VehicleJdbcRepository.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private static final String VEHICLE_COLUMNS = """
        url,
        title,
        current_price,
        original_price,
        trim_level,
        charge_type,
        exterior_color,
        seat_type,
        packs_json,
        location,
        latitude,
        longitude,
        photo_url,
        first_seen,
        last_seen,
        is_available
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final RowMapper<VehicleEntity> vehicleMapper = this::mapVehicle;

    public VehicleJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    @Override
    public VehicleEntity findByUrl(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        List<VehicleEntity> rows = jdbc.query(
            "SELECT " + VEHICLE_COLUMNS + " FROM vehicles WHERE url = :url",
            new MapSqlParameterSource("url", url),
            vehicleMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    @Override
    public void upsert(VehicleEntity entity) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("url", entity.url())
            .addValue("title", entity.title())
            .addValue("currentPrice", entity.currentPrice())
            .addValue("originalPrice", entity.originalPrice())
            .addValue("trim", entity.trim())
            .addValue("chargeType", entity.chargeType())
            .addValue("exteriorColor", entity.exteriorColor())
            .addValue("seatType", entity.seatType())
            .addValue("packsJson", writePacks(entity.packs()))
            .addValue("location", entity.location())
            .addValue("latitude", entity.latitude())
            .addValue("longitude", entity.longitude())
            .addValue("photoUrl", entity.photoUrl())
            .addValue("firstSeen", toTimestamp(entity.firstSeen()))
            .addValue("lastSeen", toTimestamp(entity.lastSeen()))
            .addValue("available", entity.available());

        int updated = jdbc.update(
            """
                UPDATE vehicles
                SET title = :title,
                    current_price = :currentPrice,
                    trim_level = :trim,
                    charge_type = :chargeType,
                    exterior_color = :exteriorColor,
                    seat_type = :seatType,
                    packs_json = :packsJson,
                    location = :location,
                    latitude = :latitude,
                    longitude = :longitude,
                    photo_url = :photoUrl,
                    last_seen = :lastSeen,
                    is_available = :available
                WHERE url = :url
                """,
            params
        );
        if (updated > 0) {
            return;
        }
        jdbc.update(
            """
                INSERT INTO vehicles (
                    url,
                    title,
                    current_price,
                    original_price,
                    trim_level,
                    charge_type,
                    exterior_color,
                    seat_type,
                    packs_json,
                    location,
                    latitude,
                    longitude,
                    photo_url,
                    first_seen,
                    last_seen,
                    is_available
                )
                VALUES (
                    :url,
                    :title,
                    :currentPrice,
                    :originalPrice,
                    :trim,
                    :chargeType,
                    :exteriorColor,
                    :seatType,
                    :packsJson,
                    :location,
                    :latitude,
                    :longitude,
                    :photoUrl,
                    :firstSeen,
                    :lastSeen,
                    :available
                )
                """,
            params
        );
    }

    @Override
    public void appendPriceHistory(String url, Long price, Instant observedAt) {
        jdbc.update(
            """
                INSERT INTO price_history (vehicle_url, price, observed_at)
                VALUES (:url, :price, :observedAt)
                """,
            new MapSqlParameterSource()
                .addValue("url", url)
                .addValue("price", price)
                .addValue("observedAt", toTimestamp(observedAt))
        );
    }

    @Override
    public int markUnavailableNotSeenSince(Instant cutoff) {
        return jdbc.update(
            """
                UPDATE vehicles
                SET is_available = FALSE
                WHERE is_available = TRUE
                  AND last_seen < :cutoff
                """,
            new MapSqlParameterSource("cutoff", toTimestamp(cutoff))
        );
    }

    @Override
    public List<CatalogVehicle> queryAll(VehicleQuery query) {
        Boolean available = query == null ? null : query.available();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("available", available);
        String availabilityClause = available == null ? "" : "WHERE is_available = :available";

        List<VehicleEntity> vehicles = jdbc.query(
            "SELECT " + VEHICLE_COLUMNS + " FROM vehicles " + availabilityClause
                + " ORDER BY last_seen DESC, current_price ASC NULLS LAST, url",
            params,
            vehicleMapper
        );
        if (vehicles.isEmpty()) {
            return List.of();
        }

        Map<String, List<PriceHistoryEntry>> historyByUrl = new HashMap<>();
        jdbc.query(
            """
                SELECT h.vehicle_url, h.price, h.observed_at
                FROM price_history h
                JOIN vehicles v ON v.url = h.vehicle_url
                """
                + (available == null ? "" : "WHERE v.is_available = :available\n")
                + "ORDER BY h.vehicle_url, h.observed_at, h.id",
            params,
            rs -> {
                PriceHistoryEntry entry = new PriceHistoryEntry(
                    rs.getString("vehicle_url"),
                    getNullableLong(rs, "price"),
                    toInstant(rs.getTimestamp("observed_at"))
                );
                historyByUrl.computeIfAbsent(entry.vehicleUrl(), key -> new ArrayList<>()).add(entry);
            }
        );

        List<CatalogVehicle> catalog = new ArrayList<>(vehicles.size());
        for (VehicleEntity vehicle : vehicles) {
            catalog.add(new CatalogVehicle(vehicle, historyByUrl.getOrDefault(vehicle.url(), List.of())));
        }
        return catalog;
    }

    public List<PriceHistoryEntry> findPriceHistory(String url) {
        return jdbc.query(
            """
                SELECT vehicle_url, price, observed_at
                FROM price_history
                WHERE vehicle_url = :url
                ORDER BY observed_at, id
                """,
            new MapSqlParameterSource("url", url),
            (rs, rowNum) -> new PriceHistoryEntry(
                rs.getString("vehicle_url"),
                getNullableLong(rs, "price"),
                toInstant(rs.getTimestamp("observed_at"))
            )
        );
    }

    @Override
    public CatalogStats catalogStats(Instant now) {
        Instant reference = now == null ? Instant.now() : now;
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("newSince", toTimestamp(reference.minus(Duration.ofHours(24))));
        CatalogStats stats = jdbc.queryForObject(
            """
                SELECT
                    (SELECT COUNT(*) FROM vehicles) AS total,
                    (SELECT COUNT(*) FROM vehicles WHERE is_available = TRUE) AS available,
                    (SELECT COUNT(*) FROM vehicles WHERE first_seen >= :newSince) AS new_in_24h,
                    (SELECT COUNT(DISTINCT vehicle_url) FROM price_history) AS with_price_history
                """,
            params,
            (rs, rowNum) -> new CatalogStats(
                rs.getLong("total"),
                rs.getLong("available"),
                rs.getLong("new_in_24h"),
                rs.getLong("with_price_history")
            )
        );
        return stats == null ? new CatalogStats(0, 0, 0, 0) : stats;
    }

    private VehicleEntity mapVehicle(ResultSet rs, int rowNum) throws SQLException {
        return new VehicleEntity(
            rs.getString("url"),
            rs.getString("title"),
            getNullableLong(rs, "current_price"),
            getNullableLong(rs, "original_price"),
            rs.getString("trim_level"),
            rs.getString("charge_type"),
            rs.getString("exterior_color"),
            rs.getString("seat_type"),
            readPacks(rs.getString("packs_json")),
            rs.getString("location"),
            getNullableDouble(rs, "latitude"),
            getNullableDouble(rs, "longitude"),
            rs.getString("photo_url"),
            toInstant(rs.getTimestamp("first_seen")),
            toInstant(rs.getTimestamp("last_seen")),
            rs.getBoolean("is_available")
        );
    }

    private String writePacks(List<String> packs) {
        if (packs == null || packs.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(packs);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize packs", e);
        }
    }

    private List<String> readPacks(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<String> parsed = objectMapper.readValue(json, STRING_LIST);
            return parsed == null ? List.of() : parsed;
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable packs column value {}", json, e);
            return List.of();
        }
    }

    private Long getNullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private Double getNullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
