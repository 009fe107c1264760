package com.slicebot.runner;

import com.slicebot.graph.Graph;
import com.slicebot.model.TimeBounds;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.function.BooleanSupplier;

/**
 * Inputs of one run. {@code cooldownMillis} overrides the configured cooldown when non-null;
 * {@code referenceNow} defaults to the orchestrator clock and is frozen for every slice.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class RetrievalOptions {
    public final Graph graph;
    public final String pinnedDsl;
    public final TimeBounds window;
    public final boolean bustCache;
    public final boolean simulate;
    public final boolean automated;
    public final Long cooldownMillis;
    public final Instant referenceNow;
    public final ProgressListener progress;
    public final BooleanSupplier shouldAbort;

    public ProgressListener progressOrNone() {
        return progress == null ? ProgressListener.NONE : progress;
    }

    public boolean abortRequested() {
        return shouldAbort != null && shouldAbort.getAsBoolean();
    }
}
