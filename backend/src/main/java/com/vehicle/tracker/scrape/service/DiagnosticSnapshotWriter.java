package com.vehicle.tracker.scrape.service;

import com.vehicle.tracker.config.ScraperProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Keeps the raw markup of the last page that failed to parse, overwriting the previous one.
 */
@Component
public class DiagnosticSnapshotWriter {
    private static final Logger log = LoggerFactory.getLogger(DiagnosticSnapshotWriter.class);

    private final ScraperProperties properties;

    public DiagnosticSnapshotWriter(ScraperProperties properties) {
        this.properties = properties;
    }

    /**
     * @return the written file, or {@code null} when nothing could be written
     */
    public Path write(String rawContent) {
        String configured = properties.getDiagnostics().getSnapshotPath();
        if (configured == null || configured.isBlank()) {
            return null;
        }
        Path target = Path.of(configured.trim());
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(
                target,
                rawContent == null ? "" : rawContent,
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE
            );
            log.info("Wrote failing page snapshot to {}", target.toAbsolutePath());
            return target;
        } catch (IOException e) {
            log.warn("Unable to write failing page snapshot to {}", target, e);
            return null;
        }
    }
}
