package com.slicebot.storage;

import com.slicebot.model.CachedRecord;

import java.util.List;

/**
 * Durable per-parameter record set. Implementations throw {@link IllegalStateException} when the
 * backing store is unavailable.
 */
public interface CachedRecordStore {

    List<CachedRecord> load(String objectId);

    /**
     * Atomically replace every record held for the object.
     */
    void replace(String objectId, List<CachedRecord> records);
}
