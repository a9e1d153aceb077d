/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.tier;

import ai.evacortex.patternmemory.core.AccessStats;
import ai.evacortex.patternmemory.core.FaultyTierStore;
import ai.evacortex.patternmemory.core.PatternRecord;
import ai.evacortex.patternmemory.core.StorageTier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static ai.evacortex.patternmemory.core.PatternTestUtils.premiumPattern;
import static org.junit.jupiter.api.Assertions.*;

class TierAdapterTest {

    private ExecutorService executor;
    private FaultyTierStore store;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        store = new FaultyTierStore();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private TierAdapter adapter(Duration timeout, int retries) {
        return new TierAdapter(StorageTier.PREMIUM, store, executor, timeout, retries, Duration.ofMillis(1));
    }

    private static PatternRecord record(String id) {
        return new PatternRecord(premiumPattern(id), StorageTier.PREMIUM, AccessStats.fresh(0L));
    }

    @Test
    void testPutThenGet_ok() {
        TierAdapter adapter = adapter(Duration.ofSeconds(2), 0);
        assertTrue(adapter.put(record("a")).isOk());

        TierOutcome<PatternRecord> outcome = adapter.get("a");
        assertEquals(TierOutcome.Status.OK, outcome.status());
        assertEquals("a", outcome.value().id());
        assertEquals(StorageTier.PREMIUM, outcome.tier());
    }

    @Test
    void testGet_missingIsNotFound() {
        TierOutcome<PatternRecord> outcome = adapter(Duration.ofSeconds(2), 0).get("nope");
        assertEquals(TierOutcome.Status.NOT_FOUND, outcome.status());
        assertFalse(outcome.isFailure());
    }

    @Test
    @Timeout(10)
    void testPut_failingBackendRetriesThenUnavailable() {
        store.failing(true);
        TierOutcome<PatternRecord> outcome = adapter(Duration.ofSeconds(2), 3).put(record("a"));

        assertEquals(TierOutcome.Status.UNAVAILABLE, outcome.status());
        assertEquals(4, store.putAttempts(), "One attempt plus three retries expected");
        assertTrue(outcome.detail().contains("backend offline"));
    }

    @Test
    @Timeout(10)
    void testPut_recoversOnRetry() {
        store.failing(true);
        TierAdapter adapter = adapter(Duration.ofSeconds(2), 0);
        assertTrue(adapter.put(record("a")).isFailure());

        store.failing(false);
        assertTrue(adapter.put(record("a")).isOk());
        assertEquals(1, store.backing().size());
    }

    @Test
    @Timeout(10)
    void testGet_slowBackendTimesOut() {
        store.backing().put("a", record("a"));
        store.delay(1_000);

        TierOutcome<PatternRecord> outcome = adapter(Duration.ofMillis(50), 0).get("a");
        assertEquals(TierOutcome.Status.TIMEOUT, outcome.status());
        assertTrue(outcome.isFailure());
    }

    @Test
    void testScanAndDeleteAndSize() {
        TierAdapter adapter = adapter(Duration.ofSeconds(2), 0);
        adapter.put(record("a"));
        adapter.put(record("b"));

        assertEquals(2, adapter.size().value());
        assertTrue(adapter.delete("a").value());
        assertFalse(adapter.delete("a").value());
        List<PatternRecord> all = adapter.scan(r -> true).value();
        assertEquals(1, all.size());
        assertEquals("b", all.get(0).id());
    }

    @Test
    void testGetAll_returnsOnlyHeldIds() {
        TierAdapter adapter = adapter(Duration.ofSeconds(2), 0);
        adapter.put(record("a"));
        adapter.put(record("c"));

        Map<String, PatternRecord> found = adapter.getAllAsync(List.of("a", "b", "c")).join().value();
        assertEquals(List.of("a", "c"), List.copyOf(found.keySet()));
    }

    @Test
    void testRejectedExecutor_isUnavailable() {
        executor.shutdown();
        TierOutcome<PatternRecord> outcome = adapter(Duration.ofSeconds(2), 0).get("a");
        assertEquals(TierOutcome.Status.UNAVAILABLE, outcome.status());
    }
}
