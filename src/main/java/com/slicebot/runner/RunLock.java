package com.slicebot.runner;

/**
 * Exclusive lock preventing two concurrent runs against the same cache.
 */
public interface RunLock {

    boolean tryAcquire(String owner);

    void release(String owner);
}
