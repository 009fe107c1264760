package com.slicebot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.LocalDate;

/**
 * One day of a conversion series: n trials, k successes.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class DailyPoint {
    public final LocalDate date;
    public final long n;
    public final long k;

    public static DailyPoint of(LocalDate date, long n, long k) {
        if (date == null) {
            throw new IllegalArgumentException("daily point requires a date");
        }
        if (n < 0 || k < 0) {
            throw new IllegalArgumentException("negative counts on " + date + ": n=" + n + " k=" + k);
        }
        return new DailyPoint(date, n, k);
    }
}
