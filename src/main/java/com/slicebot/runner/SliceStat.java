package com.slicebot.runner;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class SliceStat {
    public final String slice;
    public final int items;
    public final int success;
    public final int errors;
    public final int cacheHits;
    public final int apiFetches;
    public final long daysFetched;
    public final int skipped;
    public final boolean completed;
}
