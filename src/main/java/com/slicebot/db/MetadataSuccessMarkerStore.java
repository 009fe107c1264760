package com.slicebot.db;

import com.slicebot.runner.SuccessMarkerStore;

import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

/**
 * Stores the last clean run end time as epoch milliseconds under a single metadata key.
 */
public final class MetadataSuccessMarkerStore implements SuccessMarkerStore {
    private final MetadataDao metadata;
    private final String key;

    public MetadataSuccessMarkerStore(MetadataDao metadata, String key) {
        this.metadata = metadata;
        this.key = key;
    }

    @Override
    public void markSuccess(Instant finishedAt) {
        try {
            metadata.put(key, Long.toString(finishedAt.toEpochMilli()));
        } catch (SQLException e) {
            throw new IllegalStateException("success marker write failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<Instant> lastSuccess() {
        try {
            Optional<String> raw = metadata.get(key);
            if (raw.isEmpty() || !raw.get().trim().matches("\\d{1,19}")) {
                return Optional.empty();
            }
            return Optional.of(Instant.ofEpochMilli(Long.parseLong(raw.get().trim())));
        } catch (SQLException e) {
            throw new IllegalStateException("success marker read failed: " + e.getMessage(), e);
        }
    }
}
