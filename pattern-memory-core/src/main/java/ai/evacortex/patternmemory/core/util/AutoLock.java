/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Scoped lock holder for try-with-resources blocks.
 *
 * <pre>{@code
 * try (AutoLock ignored = AutoLock.write(lock)) {
 *     directory.put(id, placement);
 * }
 * }</pre>
 *
 * <p>Write sections are expected to cover pointer swaps only; one held longer than
 * {@link #SLOW_WRITE_MILLIS} is logged.</p>
 */
public final class AutoLock implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AutoLock.class);

    public static final long SLOW_WRITE_MILLIS = 200;

    private final Lock lock;
    private final boolean exclusive;
    private final long acquiredAt;

    private AutoLock(Lock lock, boolean exclusive) {
        this.lock = lock;
        this.exclusive = exclusive;
        lock.lock();
        this.acquiredAt = System.nanoTime();
    }

    public static AutoLock read(ReadWriteLock rw) {
        return new AutoLock(rw.readLock(), false);
    }

    public static AutoLock write(ReadWriteLock rw) {
        return new AutoLock(rw.writeLock(), true);
    }

    /** FIFO-fair lock: writers are not starved by a steady stream of queries. */
    public static ReadWriteLock fairReadWriteLock() {
        return new ReentrantReadWriteLock(true);
    }

    public long heldMillis() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - acquiredAt);
    }

    @Override
    public void close() {
        long held = heldMillis();
        lock.unlock();
        if (exclusive && held >= SLOW_WRITE_MILLIS) {
            log.warn("Write lock held for {} ms", held);
        }
    }
}
