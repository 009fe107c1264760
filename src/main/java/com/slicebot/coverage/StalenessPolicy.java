package com.slicebot.coverage;

import com.slicebot.model.CachedRecord;
import com.slicebot.model.TimeBounds;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * Decides which already-cached days should be fetched again. Only covered days are ever passed in;
 * days reported here that are also missing count as missing.
 */
@FunctionalInterface
public interface StalenessPolicy {
    StalenessPolicy NEVER = (records, requested, referenceNow) -> Set.of();

    Set<LocalDate> staleDates(List<CachedRecord> matchingRecords, TimeBounds requested, Instant referenceNow);
}
