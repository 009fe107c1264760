package com.slicebot.runner;

import com.slicebot.model.Classification;
import com.slicebot.model.ItemKey;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public final class ItemDecision {
    public enum Action {
        CACHE_HIT,
        FETCHED,
        SIMULATED,
        SKIPPED,
        RETRIED,
        FAILED,
        ABORTED
    }

    public final String slice;
    public final ItemKey itemKey;
    public final Classification classification;
    public final Action action;
    public final String detail;
}
