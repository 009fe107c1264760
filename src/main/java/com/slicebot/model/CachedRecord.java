package com.slicebot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * One observed slice of a parameter: header window, summary counts and the daily arrays they derive from.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class CachedRecord {
    public final LocalDate windowFrom;
    public final LocalDate windowTo;
    public final long n;
    public final long k;
    public final List<LocalDate> dates;
    public final List<Long> nDaily;
    public final List<Long> kDaily;
    public final String sliceDsl;
    public final String querySignature;
    public final QueryMode mode;
    public final Instant retrievedAt;

    public QueryMode modeOrDefault() {
        return mode == null ? QueryMode.WINDOW : mode;
    }

    public String signatureOrBlank() {
        return querySignature == null ? "" : querySignature.trim();
    }

    public boolean hasDailyData() {
        return dates != null && !dates.isEmpty();
    }

    public TimeBounds header() {
        if (windowFrom == null || windowTo == null || windowTo.isBefore(windowFrom)) {
            return null;
        }
        return TimeBounds.of(windowFrom, windowTo);
    }

    /**
     * Daily entries with a date and both counts present. Entries with missing or negative values are skipped.
     */
    public List<DailyPoint> dailyPoints() {
        if (!hasDailyData() || nDaily == null || kDaily == null) {
            return List.of();
        }
        int size = Math.min(dates.size(), Math.min(nDaily.size(), kDaily.size()));
        List<DailyPoint> out = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            LocalDate date = dates.get(i);
            Long dn = nDaily.get(i);
            Long dk = kDaily.get(i);
            if (date == null || dn == null || dk == null || dn < 0L || dk < 0L) {
                continue;
            }
            out.add(DailyPoint.of(date, dn, dk));
        }
        return out;
    }
}
