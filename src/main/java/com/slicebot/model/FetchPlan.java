package com.slicebot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Immutable plan for one slice. Items are ordered by the display form of their key.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class FetchPlan {
    public static final int VERSION = 1;

    public final int version;
    public final Instant createdAt;
    public final Instant referenceNow;
    public final String dsl;
    public final List<FetchPlanItem> items;

    public static FetchPlan of(Instant createdAt, Instant referenceNow, String dsl, List<FetchPlanItem> items) {
        List<FetchPlanItem> sorted = new ArrayList<>(items == null ? List.of() : items);
        sorted.sort(Comparator.comparing(i -> i.itemKey));
        return new FetchPlan(
                VERSION,
                createdAt == null ? referenceNow : createdAt,
                referenceNow,
                dsl == null ? "" : dsl,
                List.copyOf(sorted)
        );
    }

    public List<FetchPlanItem> itemsWith(Classification classification) {
        List<FetchPlanItem> out = new ArrayList<>();
        for (FetchPlanItem item : items) {
            if (item.classification == classification) {
                out.add(item);
            }
        }
        return out;
    }

    public PlanSummary summarise() {
        int covered = 0;
        int fetch = 0;
        int unfetchable = 0;
        int windowCount = 0;
        int totalDays = 0;
        int missing = 0;
        int stale = 0;
        int dbMissing = 0;
        for (FetchPlanItem item : items) {
            if (item.classification == Classification.COVERED) {
                covered++;
            } else if (item.classification == Classification.UNFETCHABLE) {
                unfetchable++;
            } else {
                fetch++;
            }
            for (FetchWindow w : item.windows) {
                windowCount++;
                totalDays += w.dayCount;
                if (w.reason == WindowReason.STALE) {
                    stale += w.dayCount;
                } else if (w.reason == WindowReason.DB_MISSING) {
                    dbMissing += w.dayCount;
                } else {
                    missing += w.dayCount;
                }
            }
        }
        return new PlanSummary(covered, fetch, unfetchable, windowCount, totalDays, missing, stale, dbMissing);
    }
}
