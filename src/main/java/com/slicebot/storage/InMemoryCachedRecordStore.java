package com.slicebot.storage;

import com.slicebot.model.CachedRecord;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

public final class InMemoryCachedRecordStore implements CachedRecordStore {
    private final Map<String, List<CachedRecord>> records = new ConcurrentHashMap<>();
    private final AtomicInteger writes = new AtomicInteger();

    @Override
    public List<CachedRecord> load(String objectId) {
        if (objectId == null) {
            return List.of();
        }
        return records.getOrDefault(objectId, List.of());
    }

    @Override
    public void replace(String objectId, List<CachedRecord> newRecords) {
        if (objectId == null || objectId.trim().isEmpty()) {
            throw new IllegalArgumentException("objectId must not be empty");
        }
        records.put(objectId, newRecords == null ? List.of() : List.copyOf(newRecords));
        writes.incrementAndGet();
    }

    public int writeCount() {
        return writes.get();
    }
}
