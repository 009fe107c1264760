package com.slicebot.runner;

import java.util.concurrent.atomic.AtomicReference;

/**
 * In-process lock; used when no shared database is configured.
 */
public final class ProcessRunLock implements RunLock {
    private final AtomicReference<String> holder = new AtomicReference<>();

    @Override
    public boolean tryAcquire(String owner) {
        return holder.compareAndSet(null, owner == null ? "" : owner);
    }

    @Override
    public void release(String owner) {
        holder.compareAndSet(owner == null ? "" : owner, null);
    }
}
