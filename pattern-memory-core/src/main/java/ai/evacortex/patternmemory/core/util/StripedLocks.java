/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.util;

import java.util.Collection;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.IntStream;

/**
 * A fixed set of exclusive locks keyed by string hash.
 *
 * <p>Keys that share a stripe share its lock. Multi-key acquisitions always take stripes in
 * ascending order, so two callers can never deadlock as long as neither acquires again while
 * holding a {@link Held}.</p>
 *
 * <pre>{@code
 * try (StripedLocks.Held ignored = locks.lockAll(List.of(a, b))) {
 *     // a and b cannot be changed by another holder
 * }
 * }</pre>
 */
public final class StripedLocks {

    private final ReentrantLock[] stripes;

    public StripedLocks(int count) {
        if (count < 1) throw new IllegalArgumentException("count must be >= 1");
        this.stripes = new ReentrantLock[count];
        for (int i = 0; i < count; i++) stripes[i] = new ReentrantLock();
    }

    public Held lock(String key) {
        return acquire(new int[]{stripeOf(key)});
    }

    public Held lockAll(Collection<String> keys) {
        return acquire(keys.stream().mapToInt(this::stripeOf).distinct().sorted().toArray());
    }

    /** Takes every stripe; nothing else can hold any key until it is closed. */
    public Held lockEverything() {
        return acquire(IntStream.range(0, stripes.length).toArray());
    }

    public boolean isHeldByCurrentThread(String key) {
        return stripes[stripeOf(key)].isHeldByCurrentThread();
    }

    public int stripeCount() {
        return stripes.length;
    }

    int stripeOf(String key) {
        return Math.floorMod(key.hashCode(), stripes.length);
    }

    private Held acquire(int[] order) {
        for (int stripe : order) stripes[stripe].lock();
        return new Held(order);
    }

    public final class Held implements AutoCloseable {

        private final int[] order;
        private boolean released;

        private Held(int[] order) {
            this.order = order;
        }

        @Override
        public void close() {
            if (released) return;
            released = true;
            for (int i = order.length - 1; i >= 0; i--) {
                stripes[order[i]].unlock();
            }
        }
    }
}
