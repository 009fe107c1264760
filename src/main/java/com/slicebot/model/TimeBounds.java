package com.slicebot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Inclusive calendar-day range.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class TimeBounds {
    public final LocalDate start;
    public final LocalDate end;

    public static TimeBounds of(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("time bounds require start and end");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("time bounds inverted: " + start + " > " + end);
        }
        return new TimeBounds(start, end);
    }

    public int dayCount() {
        return (int) ChronoUnit.DAYS.between(start, end) + 1;
    }

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(start) && !date.isAfter(end);
    }

    public boolean covers(TimeBounds other) {
        return other != null && !start.isAfter(other.start) && !end.isBefore(other.end);
    }

    public List<LocalDate> dates() {
        List<LocalDate> out = new ArrayList<>(dayCount());
        for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
            out.add(d);
        }
        return out;
    }
}
