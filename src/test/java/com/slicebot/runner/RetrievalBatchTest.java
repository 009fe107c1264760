package com.slicebot.runner;

import com.slicebot.model.QueryMode;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetrievalBatchTest {
    private static final RetrievalScope A = new RetrievalScope("param-a", "", "sig", QueryMode.WINDOW);
    private static final RetrievalScope B = new RetrievalScope("param-b", "", "sig", QueryMode.WINDOW);

    private final RetrievalBatch batch = new RetrievalBatch(
            Clock.fixed(Instant.parse("2026-02-01T00:00:00Z"), ZoneOffset.UTC));

    @Test
    void resolveShouldReturnOneEntryPerScope() {
        RetrievalBatch.Entry first = batch.resolve(A);

        assertSame(first, batch.resolve(A));
        assertNotEquals(first.batchTimestamp, batch.resolve(B).batchTimestamp);
        assertFalse(first.forcedBustCache);
        assertEquals(2, batch.size());
    }

    @Test
    void invalidateShouldReplaceOnlyThatScope() {
        RetrievalBatch.Entry a = batch.resolve(A);
        RetrievalBatch.Entry b = batch.resolve(B);

        RetrievalBatch.Entry replaced = batch.invalidate(A);

        assertTrue(replaced.forcedBustCache);
        assertTrue(replaced.batchTimestamp.isAfter(b.batchTimestamp));
        assertNotEquals(a.batchTimestamp, replaced.batchTimestamp);
        assertSame(b, batch.resolve(B));
    }

    @Test
    void clearForcedShouldKeepTimestamp() {
        RetrievalBatch.Entry replaced = batch.invalidate(A);

        RetrievalBatch.Entry cleared = batch.clearForced(A);

        assertFalse(cleared.forcedBustCache);
        assertEquals(replaced.batchTimestamp, cleared.batchTimestamp);
        assertFalse(batch.resolve(A).forcedBustCache);
    }
}
