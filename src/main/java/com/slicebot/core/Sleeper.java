package com.slicebot.core;

/**
 * Blocking pause, injectable so waits can be observed and skipped in tests.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
