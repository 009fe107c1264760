package com.slicebot.db;

import com.slicebot.runner.RunLock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;

/**
 * Cross-process lock held as a leased metadata row. A lease older than its duration is considered
 * abandoned and may be taken over.
 */
public final class MetadataRunLock implements RunLock {
    private static final Logger LOG = LogManager.getLogger(MetadataRunLock.class);

    private final MetadataDao metadata;
    private final String key;
    private final Duration lease;

    public MetadataRunLock(MetadataDao metadata, String lockName, Duration lease) {
        this.metadata = metadata;
        this.key = "lock:" + lockName;
        this.lease = lease;
    }

    @Override
    public boolean tryAcquire(String owner) {
        try {
            return metadata.putIfAbsentOrExpired(key, owner, Instant.now().minus(lease));
        } catch (SQLException e) {
            LOG.warn("run lock unavailable, proceeding unsynchronized: {}", e.getMessage());
            return true;
        }
    }

    @Override
    public void release(String owner) {
        try {
            metadata.deleteIfValue(key, owner);
        } catch (SQLException e) {
            LOG.warn("run lock release failed key={}: {}", key, e.getMessage());
        }
    }
}
