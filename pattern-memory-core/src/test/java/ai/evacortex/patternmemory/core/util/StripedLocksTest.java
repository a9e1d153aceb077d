/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(30)
class StripedLocksTest {

    @Test
    void testLockAll_holdsEveryKeyUntilClosed() {
        StripedLocks locks = new StripedLocks(8);
        StripedLocks.Held held = locks.lockAll(List.of("a", "b", "a"));
        assertTrue(locks.isHeldByCurrentThread("a"));
        assertTrue(locks.isHeldByCurrentThread("b"));

        held.close();
        held.close();
        assertFalse(locks.isHeldByCurrentThread("a"), "Closing twice must not unlock twice");
        assertFalse(locks.isHeldByCurrentThread("b"));
    }

    @Test
    void testLock_blocksOtherThreadsOnSameKey() throws Exception {
        StripedLocks locks = new StripedLocks(4);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> waiting;
            try (StripedLocks.Held ignored = locks.lock("x")) {
                waiting = executor.submit(() -> {
                    try (StripedLocks.Held inner = locks.lock("x")) {
                        assertTrue(locks.isHeldByCurrentThread("x"));
                    }
                });
                assertThrows(TimeoutException.class, () -> waiting.get(200, TimeUnit.MILLISECONDS));
            }
            waiting.get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testOpposedKeyOrdersDoNotDeadlock() throws Exception {
        StripedLocks locks = new StripedLocks(16);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<?> forward = executor.submit(() -> repeat(locks, start, List.of("left", "right")));
            Future<?> backward = executor.submit(() -> repeat(locks, start, List.of("right", "left")));
            start.countDown();
            forward.get(20, TimeUnit.SECONDS);
            backward.get(20, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
    }

    private static Void repeat(StripedLocks locks, CountDownLatch start, List<String> keys) throws InterruptedException {
        start.await();
        for (int i = 0; i < 10_000; i++) {
            try (StripedLocks.Held ignored = locks.lockAll(keys)) {
                Thread.onSpinWait();
            }
        }
        return null;
    }

    @Test
    void testLockEverything_coversUnseenKeys() {
        StripedLocks locks = new StripedLocks(4);
        try (StripedLocks.Held ignored = locks.lockEverything()) {
            for (String key : List.of("p-1", "p-2", "some other id", "")) {
                assertTrue(locks.isHeldByCurrentThread(key), key);
            }
        }
        assertFalse(locks.isHeldByCurrentThread("p-1"));
        assertEquals(4, locks.stripeCount());
    }

    @Test
    void testStripeCount_mustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new StripedLocks(0));
    }
}
