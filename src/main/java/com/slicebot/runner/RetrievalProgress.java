package com.slicebot.runner;

import com.slicebot.model.ItemKey;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Progress event. BEFORE_ITEM carries the item's cache status, AFTER_ITEM the running totals,
 * COOLDOWN the wait about to start.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class RetrievalProgress {
    public enum Type {
        BEFORE_ITEM,
        AFTER_ITEM,
        COOLDOWN
    }

    public final Type type;
    public final int sliceIndex;
    public final int sliceCount;
    public final String slice;
    public final ItemKey itemKey;
    public final boolean cacheHit;
    public final int daysToFetch;
    public final int gapCount;
    public final int totalSuccess;
    public final int totalErrors;
    public final int totalCacheHits;
    public final int totalApiFetches;
    public final long totalDaysFetched;
    public final long cooldownMs;
}
