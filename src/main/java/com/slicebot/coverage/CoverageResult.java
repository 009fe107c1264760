package com.slicebot.coverage;

import com.slicebot.model.Classification;
import com.slicebot.model.FetchWindow;

import java.util.List;

public final class CoverageResult {
    public enum Selection {
        DIRECT,
        CONTEXT_ANY,
        MECE_PARTITION,
        NONE
    }

    public final Classification classification;
    public final Selection selection;
    public final List<FetchWindow> windows;
    public final int missingDays;
    public final int staleDays;
    public final List<ComponentCoverage> components;
    public final boolean meceAggregationError;
    public final List<String> notes;

    CoverageResult(
            Classification classification,
            Selection selection,
            List<FetchWindow> windows,
            int missingDays,
            int staleDays,
            List<ComponentCoverage> components,
            boolean meceAggregationError,
            List<String> notes
    ) {
        this.classification = classification;
        this.selection = selection;
        this.windows = FetchWindow.sorted(windows);
        this.missingDays = missingDays;
        this.staleDays = staleDays;
        this.components = List.copyOf(components);
        this.meceAggregationError = meceAggregationError;
        this.notes = List.copyOf(notes);
    }

    public boolean isCovered() {
        return classification == Classification.COVERED;
    }

    public int gapCount() {
        return windows.size();
    }
}
