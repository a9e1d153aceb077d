/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.exec;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(20)
class AdaptiveWorkerPoolTest {

    private volatile double usage = 0.5;
    private AdaptiveWorkerPool pool;

    private AdaptiveWorkerPool pool(int floor, int ceiling) {
        WorkerPoolConfig config = new WorkerPoolConfig(floor, ceiling, Duration.ZERO, 0.8, Duration.ofSeconds(10));
        pool = new AdaptiveWorkerPool(config, () -> usage);
        return pool;
    }

    @AfterEach
    void tearDown() {
        if (pool != null) pool.shutdown(Duration.ofSeconds(1));
    }

    @ParameterizedTest
    @CsvSource({
            "0.95, 0.8, CRITICAL",
            "0.85, 0.8, HIGH",
            "0.50, 0.8, LOW",
            "0.60, 0.8, MEDIUM",
            "0.75, 0.8, MEDIUM",
            "0.30, 0.4, LOW",
            "0.30, 0.2, MEDIUM"
    })
    void testClassify(double sample, double threshold, MemoryPressure expected) {
        assertEquals(expected, MemoryPressure.classify(sample, threshold));
    }

    @Test
    void testSubmit_returnsResult() throws Exception {
        assertEquals(42, pool(2, 4).submit(() -> 42).get(5, TimeUnit.SECONDS));
        assertEquals(2, pool.poolSize(), "Floor workers are prestarted");
    }

    @Test
    void testResize_staysWithinBounds() {
        AdaptiveWorkerPool p = pool(1, 3);
        CountDownLatch release = new CountDownLatch(1);
        List<CompletableFuture<Boolean>> blocked = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            blocked.add(p.submit(() -> release.await(10, TimeUnit.SECONDS)));
        }

        usage = 0.1;
        for (int i = 0; i < 5; i++) {
            assertEquals(MemoryPressure.LOW, p.adjustNow());
        }
        assertEquals(3, p.coreSize(), "Growth is capped at the ceiling");

        usage = 0.95;
        assertEquals(MemoryPressure.CRITICAL, p.adjustNow());
        assertEquals(1, p.coreSize(), "Shrinking stops at the floor");
        p.adjustNow();
        assertEquals(1, p.coreSize());
        assertEquals(MemoryPressure.CRITICAL, p.stats().lastPressure());

        release.countDown();
        blocked.forEach(CompletableFuture::join);
    }

    @Test
    void testSubmit_timesOut() {
        AdaptiveWorkerPool p = pool(1, 2);
        CompletableFuture<String> slow = p.submit(() -> {
            Thread.sleep(5_000);
            return "late";
        }, Duration.ofMillis(50));

        ExecutionException e = assertThrows(ExecutionException.class, () -> slow.get(5, TimeUnit.SECONDS));
        assertInstanceOf(TimeoutException.class, e.getCause());
        assertEquals(1, p.stats().timedOut());
    }

    @Test
    void testShutdown_rejectsQueuedAndNewWork() throws Exception {
        AdaptiveWorkerPool p = pool(1, 1);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch never = new CountDownLatch(1);
        CompletableFuture<Boolean> running = p.submit(() -> {
            started.countDown();
            return never.await(10, TimeUnit.SECONDS);
        });
        assertTrue(started.await(5, TimeUnit.SECONDS));
        CompletableFuture<String> queued = p.submit(() -> "never runs");

        p.shutdown(Duration.ofMillis(100));

        ExecutionException e = assertThrows(ExecutionException.class, () -> queued.get(5, TimeUnit.SECONDS));
        assertInstanceOf(RejectedExecutionException.class, e.getCause());
        assertThrows(ExecutionException.class, () -> running.get(5, TimeUnit.SECONDS),
                "Running task is interrupted after the grace period");

        CompletableFuture<String> late = p.submit(() -> "too late");
        assertTrue(late.isCompletedExceptionally());
        assertTrue(p.isShutdown());
        assertTrue(p.stats().rejected() >= 2);
    }

    @Test
    void testInvalidConfig() {
        assertThrows(IllegalArgumentException.class,
                () -> new WorkerPoolConfig(0, 1, Duration.ZERO, 0.8, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
                () -> new WorkerPoolConfig(3, 2, Duration.ZERO, 0.8, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
                () -> new WorkerPoolConfig(1, 2, Duration.ZERO, 1.5, Duration.ofSeconds(1)));
    }
}
