package com.slicebot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

/**
 * Contiguous day range to fetch, tagged with why it is needed.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class FetchWindow {
    public static final Comparator<FetchWindow> BY_START = Comparator
            .comparing((FetchWindow w) -> w.start)
            .thenComparing(w -> w.end)
            .thenComparing(w -> w.reason);

    public final LocalDate start;
    public final LocalDate end;
    public final WindowReason reason;
    public final int dayCount;

    public static FetchWindow of(LocalDate start, LocalDate end, WindowReason reason) {
        TimeBounds bounds = TimeBounds.of(start, end);
        return new FetchWindow(start, end, reason == null ? WindowReason.MISSING : reason, bounds.dayCount());
    }

    public TimeBounds bounds() {
        return TimeBounds.of(start, end);
    }

    /**
     * Collapse a set of days into the minimal list of contiguous windows.
     */
    public static List<FetchWindow> mergeDates(Collection<LocalDate> dates, WindowReason reason) {
        List<FetchWindow> out = new ArrayList<>();
        if (dates == null || dates.isEmpty()) {
            return out;
        }
        LocalDate runStart = null;
        LocalDate prev = null;
        for (LocalDate d : new TreeSet<>(dates)) {
            if (runStart == null) {
                runStart = d;
            } else if (!d.equals(prev.plusDays(1))) {
                out.add(of(runStart, prev, reason));
                runStart = d;
            }
            prev = d;
        }
        out.add(of(runStart, prev, reason));
        return out;
    }

    public static List<FetchWindow> sorted(Collection<FetchWindow> windows) {
        List<FetchWindow> out = new ArrayList<>(windows);
        out.sort(BY_START);
        return List.copyOf(out);
    }

    public static int totalDays(Collection<FetchWindow> windows) {
        int total = 0;
        for (FetchWindow w : windows) {
            total += w.dayCount;
        }
        return total;
    }
}
