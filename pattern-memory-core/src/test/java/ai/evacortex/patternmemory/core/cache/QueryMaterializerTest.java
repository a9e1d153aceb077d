/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.cache;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class QueryMaterializerTest {

    private static final Set<QueryMaterializer.Dependency> PATTERNS = EnumSet.of(QueryMaterializer.Dependency.PATTERNS);
    private static final Set<QueryMaterializer.Dependency> TIERS = EnumSet.of(QueryMaterializer.Dependency.TIERS);

    private final AtomicLong nanos = new AtomicLong();
    private final AtomicInteger computations = new AtomicInteger();

    private QueryMaterializer materializer(int maxViews, long minAccess) {
        return new QueryMaterializer(Duration.ofMinutes(5), maxViews, minAccess, 10_000, nanos::get);
    }

    private String compute(QueryMaterializer m, String name, Set<QueryMaterializer.Dependency> deps) {
        return m.getOrCompute(name, Map.of(), deps, () -> name + "-" + computations.incrementAndGet());
    }

    @Test
    void testMaterializesAfterMinAccessCount() {
        QueryMaterializer m = materializer(10, 3);

        assertEquals("q-1", compute(m, "q", PATTERNS));
        assertEquals("q-2", compute(m, "q", PATTERNS));
        assertFalse(m.isMaterialized("q", Map.of()));

        assertEquals("q-3", compute(m, "q", PATTERNS));
        assertTrue(m.isMaterialized("q", Map.of()));
        assertEquals("q-3", compute(m, "q", PATTERNS), "Fourth request is served from the view");
        assertEquals(3, computations.get());

        MaterializerStats stats = m.getStats();
        assertEquals(1, stats.viewCount());
        assertEquals(1, stats.hits());
        assertEquals(3, stats.misses());
        assertEquals(4L, stats.accessCounts().get(QueryMaterializer.signature("q", Map.of())));
    }

    @Test
    void testViewsExpireAfterTtl() {
        QueryMaterializer m = materializer(10, 1);
        compute(m, "q", PATTERNS);
        assertEquals("q-1", compute(m, "q", PATTERNS));

        nanos.addAndGet(TimeUnit.MINUTES.toNanos(6));
        assertEquals("q-2", compute(m, "q", PATTERNS), "Expired view must be recomputed");
    }

    @Test
    void testInvalidateDropsOnlyDependentViews() {
        QueryMaterializer m = materializer(10, 1);
        compute(m, "byPattern", PATTERNS);
        compute(m, "byTier", TIERS);

        m.invalidate(QueryMaterializer.Dependency.TIERS);

        assertTrue(m.isMaterialized("byPattern", Map.of()));
        assertFalse(m.isMaterialized("byTier", Map.of()));

        m.invalidateAll();
        assertEquals(0, m.getStats().viewCount());
    }

    @Test
    void testSignatureIsCanonical() {
        assertEquals(QueryMaterializer.signature(" Top ", Map.of("b", 2, "a", 1)),
                QueryMaterializer.signature("top", Map.of("a", 1, "b", 2)));
        assertNotEquals(QueryMaterializer.signature("top", Map.of("a", 1)),
                QueryMaterializer.signature("top", Map.of("a", 2)));
        assertEquals(32, QueryMaterializer.signature("top", Map.of()).length());
    }

    @Test
    void testLeastAccessedViewIsEvicted() {
        QueryMaterializer m = materializer(2, 1);
        compute(m, "popular", PATTERNS);
        compute(m, "popular", PATTERNS);
        compute(m, "popular", PATTERNS);
        compute(m, "rare", PATTERNS);
        compute(m, "fresh", PATTERNS);

        assertTrue(m.isMaterialized("popular", Map.of()));
        assertFalse(m.isMaterialized("rare", Map.of()));
        assertTrue(m.isMaterialized("fresh", Map.of()));
        assertEquals(2, m.getStats().viewCount());
    }

    @Test
    void testAggregateQueryDependencies() {
        QueryMaterializer m = materializer(10, 1);
        m.getOrCompute(AggregateQuery.TIER_DISTRIBUTION, () -> "tiers");
        m.invalidate(QueryMaterializer.Dependency.ACCESS);
        assertTrue(m.isMaterialized(AggregateQuery.TIER_DISTRIBUTION.name(), Map.of()));
        m.invalidate(QueryMaterializer.Dependency.TIERS);
        assertFalse(m.isMaterialized(AggregateQuery.TIER_DISTRIBUTION.name(), Map.of()));
    }
}
