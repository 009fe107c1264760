package com.slicebot.runner;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Per-run map from scope to its live batch timestamp and forced cache-bust flag. Only the orchestrator
 * mutates it, one item at a time.
 */
public final class RetrievalBatch {
    private final Clock clock;
    private final Map<RetrievalScope, Entry> entries = new HashMap<>();
    private Instant lastMinted = Instant.EPOCH;

    public RetrievalBatch(Clock clock) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public Entry resolve(RetrievalScope scope) {
        Entry entry = entries.get(scope);
        if (entry == null) {
            entry = new Entry(mint(), false);
            entries.put(scope, entry);
        }
        return entry;
    }

    /**
     * Replace the scope's batch after a failure: fresh timestamp, cache bust forced until cleared.
     */
    public Entry invalidate(RetrievalScope scope) {
        Entry entry = new Entry(mint(), true);
        entries.put(scope, entry);
        return entry;
    }

    public Entry clearForced(RetrievalScope scope) {
        Entry current = entries.get(scope);
        if (current == null || !current.forcedBustCache) {
            return current;
        }
        Entry cleared = new Entry(current.batchTimestamp, false);
        entries.put(scope, cleared);
        return cleared;
    }

    public int size() {
        return entries.size();
    }

    // Timestamps are strictly increasing within a run even when the clock does not move.
    private Instant mint() {
        Instant now = clock.instant();
        if (!now.isAfter(lastMinted)) {
            now = lastMinted.plusMillis(1);
        }
        lastMinted = now;
        return now;
    }

    public static final class Entry {
        public final Instant batchTimestamp;
        public final boolean forcedBustCache;

        Entry(Instant batchTimestamp, boolean forcedBustCache) {
            this.batchTimestamp = batchTimestamp;
            this.forcedBustCache = forcedBustCache;
        }
    }
}
