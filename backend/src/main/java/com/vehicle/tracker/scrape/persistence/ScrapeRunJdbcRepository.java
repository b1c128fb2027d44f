package com.vehicle.tracker.scrape.persistence;

import com.vehicle.tracker.scrape.model.RunCounters;
import com.vehicle.tracker.scrape.model.ScrapeRunMeta;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * Ledger of scrape runs. One row per accepted start, finished with the terminal status.
 */
@Repository
public class ScrapeRunJdbcRepository {
    private static final String RUN_COLUMNS = """
        id,
        started_at,
        finished_at,
        status,
        notes,
        pages_loaded,
        listings_processed,
        listings_added,
        price_changes,
        last_heartbeat_at
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final RowMapper<ScrapeRunMeta> runMapper = (rs, rowNum) -> new ScrapeRunMeta(
        rs.getLong("id"),
        toInstant(rs.getTimestamp("started_at")),
        toInstant(rs.getTimestamp("finished_at")),
        rs.getString("status"),
        rs.getString("notes"),
        new RunCounters(
            rs.getInt("pages_loaded"),
            rs.getInt("listings_processed"),
            rs.getInt("listings_added"),
            rs.getInt("price_changes")
        ),
        toInstant(rs.getTimestamp("last_heartbeat_at"))
    );

    public ScrapeRunJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public long insertScrapeRun(Instant startedAt, String status, String notes) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("startedAt", toTimestamp(startedAt))
            .addValue("status", status)
            .addValue("notes", notes)
            .addValue("lastHeartbeatAt", toTimestamp(startedAt));

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO scrape_runs (
                    started_at,
                    status,
                    notes,
                    pages_loaded,
                    listings_processed,
                    listings_added,
                    price_changes,
                    last_heartbeat_at
                )
                VALUES (
                    :startedAt,
                    :status,
                    :notes,
                    0,
                    0,
                    0,
                    0,
                    :lastHeartbeatAt
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert scrape run");
        }
        return key.longValue();
    }

    public void updateScrapeRunProgress(long scrapeRunId, RunCounters counters, Instant heartbeatAt) {
        RunCounters values = counters == null ? RunCounters.ZERO : counters;
        jdbc.update(
            """
                UPDATE scrape_runs
                SET pages_loaded = :pagesLoaded,
                    listings_processed = :listingsProcessed,
                    listings_added = :listingsAdded,
                    price_changes = :priceChanges,
                    last_heartbeat_at = COALESCE(:lastHeartbeatAt, last_heartbeat_at)
                WHERE id = :scrapeRunId
                """,
            counterParams(scrapeRunId, values).addValue("lastHeartbeatAt", toTimestamp(heartbeatAt))
        );
    }

    public void updateScrapeRunHeartbeat(long scrapeRunId, Instant heartbeatAt) {
        jdbc.update(
            """
                UPDATE scrape_runs
                SET last_heartbeat_at = COALESCE(:lastHeartbeatAt, last_heartbeat_at)
                WHERE id = :scrapeRunId
                """,
            new MapSqlParameterSource()
                .addValue("scrapeRunId", scrapeRunId)
                .addValue("lastHeartbeatAt", toTimestamp(heartbeatAt))
        );
    }

    public void completeScrapeRun(
        long scrapeRunId,
        Instant finishedAt,
        String status,
        String notes,
        RunCounters counters
    ) {
        RunCounters values = counters == null ? RunCounters.ZERO : counters;
        jdbc.update(
            """
                UPDATE scrape_runs
                SET finished_at = :finishedAt,
                    status = :status,
                    notes = :notes,
                    pages_loaded = :pagesLoaded,
                    listings_processed = :listingsProcessed,
                    listings_added = :listingsAdded,
                    price_changes = :priceChanges,
                    last_heartbeat_at = COALESCE(:finishedAt, last_heartbeat_at)
                WHERE id = :scrapeRunId
                """,
            counterParams(scrapeRunId, values)
                .addValue("finishedAt", toTimestamp(finishedAt))
                .addValue("status", status)
                .addValue("notes", notes)
        );
    }

    public ScrapeRunMeta findScrapeRunById(long scrapeRunId) {
        List<ScrapeRunMeta> rows = jdbc.query(
            "SELECT " + RUN_COLUMNS + " FROM scrape_runs WHERE id = :scrapeRunId",
            new MapSqlParameterSource("scrapeRunId", scrapeRunId),
            runMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public ScrapeRunMeta findMostRecentCompletedScrapeRun() {
        List<ScrapeRunMeta> rows = jdbc.query(
            "SELECT " + RUN_COLUMNS + """
                FROM scrape_runs
                WHERE status = 'COMPLETED'
                ORDER BY finished_at DESC, id DESC
                LIMIT 1
                """,
            new MapSqlParameterSource(),
            runMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<ScrapeRunMeta> findRecentScrapeRuns(int limit) {
        return jdbc.query(
            "SELECT " + RUN_COLUMNS + """
                FROM scrape_runs
                ORDER BY started_at DESC, id DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource("limit", Math.max(1, limit)),
            runMapper
        );
    }

    public List<ScrapeRunMeta> findRunningScrapeRuns() {
        return jdbc.query(
            "SELECT " + RUN_COLUMNS + """
                FROM scrape_runs
                WHERE status = 'RUNNING'
                ORDER BY started_at, id
                """,
            new MapSqlParameterSource(),
            runMapper
        );
    }

    private MapSqlParameterSource counterParams(long scrapeRunId, RunCounters counters) {
        return new MapSqlParameterSource()
            .addValue("scrapeRunId", scrapeRunId)
            .addValue("pagesLoaded", counters.pagesLoaded())
            .addValue("listingsProcessed", counters.listingsProcessed())
            .addValue("listingsAdded", counters.listingsAdded())
            .addValue("priceChanges", counters.priceChanges());
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
