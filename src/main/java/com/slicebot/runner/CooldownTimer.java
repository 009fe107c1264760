package com.slicebot.runner;

import com.slicebot.core.Sleeper;

import java.util.function.BooleanSupplier;

/**
 * Cancellable wait, polled against an abort signal at a fixed granularity.
 */
public final class CooldownTimer {
    private final Sleeper sleeper;
    private final long pollMs;

    public CooldownTimer(Sleeper sleeper, long pollMs) {
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
        this.pollMs = Math.max(1L, pollMs);
    }

    /**
     * @return true when the full duration elapsed, false when the abort signal fired first
     */
    public boolean await(long durationMs, BooleanSupplier shouldAbort) throws InterruptedException {
        long waited = 0L;
        while (waited < durationMs) {
            if (shouldAbort != null && shouldAbort.getAsBoolean()) {
                return false;
            }
            long step = Math.min(pollMs, durationMs - waited);
            sleeper.sleep(step);
            waited += step;
        }
        return shouldAbort == null || !shouldAbort.getAsBoolean();
    }
}
