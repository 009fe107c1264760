package com.slicebot.runner;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class RetrievalResult {
    public final int totalSlices;
    public final int totalItems;
    public final int totalSuccess;
    public final int totalErrors;
    public final boolean aborted;
    public final String abortReason;
    public final int totalCacheHits;
    public final int totalApiFetches;
    public final long totalDaysFetched;
    public final int remainingSlices;
    public final int remainingItems;
    public final boolean simulated;
    public final boolean successMarkerWritten;
    public final Instant referenceNow;
    public final Instant finishedAt;
    public final List<SliceStat> sliceStats;
    public final List<ItemDecision> decisions;

    public boolean isClean() {
        return !aborted && totalErrors == 0;
    }
}
