package com.slicebot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class PlanSummary {
    public final int coveredItems;
    public final int fetchItems;
    public final int unfetchableItems;
    public final int fetchWindows;
    public final int totalFetchDays;
    public final int missingDays;
    public final int staleDays;
    public final int dbMissingDays;
}
