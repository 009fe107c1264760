package com.slicebot.coverage;

import com.slicebot.model.CachedRecord;
import com.slicebot.model.FetchWindow;
import com.slicebot.model.SliceConstraint;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * Coverage of one concrete slice inside a request (the whole request, or one contextAny/MECE member).
 * {@link #windows} holds this slice's own missing and stale days; siblings never fill them.
 */
public final class ComponentCoverage {
    public final SliceConstraint constraint;
    public final String sliceFamily;
    public final String querySignature;
    public final boolean covered;
    public final List<CachedRecord> matchingRecords;
    public final Set<LocalDate> missingDates;
    public final List<FetchWindow> windows;

    ComponentCoverage(
            SliceConstraint constraint,
            String querySignature,
            boolean covered,
            List<CachedRecord> matchingRecords,
            Set<LocalDate> missingDates,
            List<FetchWindow> windows
    ) {
        this.constraint = constraint;
        this.sliceFamily = constraint.sliceFamily();
        this.querySignature = querySignature;
        this.covered = covered;
        this.matchingRecords = List.copyOf(matchingRecords);
        this.missingDates = Set.copyOf(missingDates);
        this.windows = FetchWindow.sorted(windows);
    }

    ComponentCoverage withWindows(List<FetchWindow> newWindows) {
        return new ComponentCoverage(constraint, querySignature, covered && newWindows.isEmpty(), matchingRecords,
                missingDates, newWindows);
    }

    public boolean needsFetch() {
        return !windows.isEmpty();
    }
}
