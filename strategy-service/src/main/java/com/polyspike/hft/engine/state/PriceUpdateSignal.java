package com.polyspike.hft.engine.state;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Level-triggered "prices changed" notification. Waiters remember the last version they processed and are released
 * as soon as the version moves past it, so a signal raised while nobody waits is never lost.
 */
public final class PriceUpdateSignal {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private long version;

    public void signal() {
        lock.lock();
        try {
            version++;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public long version() {
        lock.lock();
        try {
            return version;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits until the version differs from {@code lastSeen} or the timeout elapses; returns the current version.
     */
    public long awaitUpdate(long lastSeen, Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (version == lastSeen && remaining > 0) {
                remaining = changed.awaitNanos(remaining);
            }
            return version;
        } finally {
            lock.unlock();
        }
    }
}
