/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.engine;

import ai.evacortex.patternmemory.core.CodeLocation;
import ai.evacortex.patternmemory.core.FaultyTierStore;
import ai.evacortex.patternmemory.core.MutableClock;
import ai.evacortex.patternmemory.core.Pattern;
import ai.evacortex.patternmemory.core.PatternContent;
import ai.evacortex.patternmemory.core.StorageTier;
import ai.evacortex.patternmemory.core.dedup.DeduplicationResult;
import ai.evacortex.patternmemory.core.events.NoOpTracer;
import ai.evacortex.patternmemory.core.tier.TierStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static ai.evacortex.patternmemory.core.PatternTestUtils.pattern;
import static ai.evacortex.patternmemory.core.PatternTestUtils.premiumPattern;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Stores that race with migration, deduplication and warming. Tier calls are held open with
 * one-shot gates so every interleaving is forced rather than hoped for.
 */
@TestInstance(TestInstance.Lifecycle.PER_METHOD)
@Timeout(60)
class PatternMemoryRaceTest {

    private static final long T0 = 1_700_000_000_000L;

    private MutableClock clock;
    private Map<StorageTier, FaultyTierStore> stores;
    private PatternMemoryEngine engine;
    private ExecutorService executor;

    private final CountDownLatch entered = new CountDownLatch(1);
    private final CountDownLatch release = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        stores = new EnumMap<>(StorageTier.class);
        for (StorageTier tier : StorageTier.values()) stores.put(tier, new FaultyTierStore());
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        executor.shutdownNow();
        if (engine != null) engine.close();
    }

    private void open(boolean dedupOnStore) {
        MemoryEngineConfig config = MemoryEngineConfig.builder()
                .tierTimeout(Duration.ofSeconds(10))
                .writeRetries(0)
                .retryBackoff(Duration.ofMillis(1))
                .ioThreads(4)
                .dedupOnStore(dedupOnStore)
                .build();
        engine = new PatternMemoryEngine(config, new EnumMap<StorageTier, TierStore>(stores), NoOpTracer.INSTANCE, clock);
    }

    private void gateNextPutOnEveryTier() {
        stores.values().forEach(s -> s.gateNextPut(entered, release));
    }

    private static Pattern retitled(Pattern p, String title) {
        PatternContent c = p.content();
        return new Pattern(p.id(), p.coordinate(), PatternContent.of(title, c.description(), c.type()),
                p.profile(), p.locations(), p.evidence(), p.relations(), p.createdAt());
    }

    private static Pattern leakedStream(String id, long createdAt) {
        return Pattern.builder()
                .id(id)
                .content("Leaked stream", "stream opened outside try-with-resources", "resources")
                .profile("general", 0.8, 0.7, 5.0, 20)
                .location(CodeLocation.of("src/main/Io.java", 5, 9))
                .createdAt(createdAt)
                .build();
    }

    private int tiersHolding(String id) {
        int n = 0;
        for (FaultyTierStore s : stores.values()) {
            if (s.backing().get(id).isPresent()) n++;
        }
        return n;
    }

    private static void assertStillWaiting(Future<?> f, String message) throws Exception {
        assertThrows(TimeoutException.class, () -> f.get(200, TimeUnit.MILLISECONDS), message);
    }

    @Test
    void testStoreDuringDemotionKeepsNewVersion() throws Exception {
        open(true);
        engine.store(premiumPattern("p"));
        clock.advance(Duration.ofDays(30));

        gateNextPutOnEveryTier();
        Future<?> migrating = executor.submit(() -> engine.migrate());
        assertTrue(entered.await(10, TimeUnit.SECONDS), "Demotion never reached the archive tier");

        Pattern renamed = retitled(premiumPattern("p"), "renamed while demoting");
        Future<StoreOutcome> storing = executor.submit(() -> engine.store(renamed));
        assertStillWaiting(storing, "Store must wait for the move of the same pattern");

        release.countDown();
        migrating.get(10, TimeUnit.SECONDS);
        storing.get(10, TimeUnit.SECONDS);

        assertEquals("renamed while demoting", engine.get("p").orElseThrow().content().title());
        assertEquals(1, tiersHolding("p"), "Exactly one tier holds the pattern");
        assertTrue(stores.get(StorageTier.ARCHIVE).backing().get("p").isPresent());
        engine.requireConsistent();
    }

    @Test
    void testStoreDuringMergeIsNotDeleted() throws Exception {
        open(false);
        engine.store(leakedStream("d1", 1_000L));
        engine.store(leakedStream("d2", 1_000L));

        gateNextPutOnEveryTier();
        Future<DeduplicationResult> deduplicating = executor.submit(() -> engine.deduplicate());
        assertTrue(entered.await(10, TimeUnit.SECONDS), "Merge never wrote its record");

        Pattern replacement = retitled(pattern("d2", "general", 0.8, 0.7, 5.0, 20), "stored during merge");
        Future<StoreOutcome> storing = executor.submit(() -> engine.store(replacement));
        assertStillWaiting(storing, "Store must wait for the merge that absorbs the same id");

        release.countDown();
        assertEquals(1, deduplicating.get(10, TimeUnit.SECONDS).merged());
        assertEquals(StoreOutcome.STORED, storing.get(10, TimeUnit.SECONDS));

        assertEquals(40, engine.get("d1").orElseThrow().profile().occurrences());
        assertEquals("stored during merge", engine.get("d2").orElseThrow().content().title());
        assertEquals(1, tiersHolding("d2"));
        assertEquals(2, engine.stats().totalPatterns());
        engine.requireConsistent();
    }

    @Test
    void testPatternRewrittenWhileDeduplicatingIsLeftForNextRun() throws Exception {
        open(false);
        engine.store(leakedStream("d1", 1_000L));
        engine.store(leakedStream("d2", 1_000L));

        stores.get(StorageTier.STANDARD).gateNextGet(entered, release);
        Future<DeduplicationResult> deduplicating = executor.submit(() -> engine.deduplicate());
        assertTrue(entered.await(10, TimeUnit.SECONDS), "Deduplication never read the standard tier");

        assertEquals(StoreOutcome.STORED, executor.submit(() -> engine.store(leakedStream("d2", 2_000L)))
                .get(10, TimeUnit.SECONDS));

        release.countDown();
        DeduplicationResult first = deduplicating.get(10, TimeUnit.SECONDS);
        assertEquals(0, first.merged(), "A pattern replaced after the run started is not merged");
        assertEquals(2_000L, engine.get("d2").orElseThrow().createdAt());
        assertEquals(2, engine.stats().totalPatterns());
        engine.requireConsistent();

        DeduplicationResult second = engine.deduplicate();
        assertEquals(1, second.merged());
        assertEquals(1, engine.stats().totalPatterns());
        Pattern survivor = engine.get("d1").or(() -> engine.get("d2")).orElseThrow();
        assertEquals(40, survivor.profile().occurrences());
        engine.requireConsistent();
    }

    @Test
    void testStoreDuringWarmingPromotionKeepsNewVersion() throws Exception {
        open(true);
        Pattern p = pattern("p", "general", 0.8, 0.7, 5.0, 20);
        engine.store(p);
        for (int i = 0; i < 3; i++) engine.get("p");

        gateNextPutOnEveryTier();
        Future<?> warming = executor.submit(() -> engine.warmCache());
        assertTrue(entered.await(10, TimeUnit.SECONDS), "Warming never promoted the pattern");

        Future<StoreOutcome> storing = executor.submit(() -> engine.store(retitled(p, "renamed while warming")));
        assertStillWaiting(storing, "Store must wait for the promotion of the same pattern");

        release.countDown();
        warming.get(10, TimeUnit.SECONDS);
        storing.get(10, TimeUnit.SECONDS);

        assertEquals("renamed while warming", engine.get("p").orElseThrow().content().title());
        assertEquals(1, tiersHolding("p"), "Exactly one tier holds the pattern");
        engine.requireConsistent();
    }
}
