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
import ai.evacortex.patternmemory.core.HarmonicProfile;
import ai.evacortex.patternmemory.core.PatternCategory;
import ai.evacortex.patternmemory.core.StorageTier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class QualityTierRouterTest {

    private static final long DAY = Duration.ofDays(1).toMillis();

    private final QualityTierRouter router = new QualityTierRouter(TierPolicy.defaults(), 100);

    @ParameterizedTest
    @CsvSource({
            "1.0, PREMIUM",
            "0.80, PREMIUM",
            "0.7999, STANDARD",
            "0.60, STANDARD",
            "0.5999, ARCHIVE",
            "0.35, ARCHIVE",
            "0.3499, REJECTED",
            "0.0, REJECTED"
    })
    void testTierFor_bands(double score, StorageTier expected) {
        assertEquals(expected, TierPolicy.defaults().tierFor(score));
    }

    @Test
    void testAssign_premiumPattern() {
        QualityTierRouter.Assignment a = router.assign(HarmonicProfile.of("general", 0.95, 0.95, 5.0, 50),
                AccessStats.fresh(0L), 0L);
        assertEquals(StorageTier.PREMIUM, a.tier());
        assertEquals(0.885, a.score(), 1e-3);
    }

    @Test
    void testEvaluate_isMonotonicInScore() {
        Random random = new Random(1234);
        PatternCategory[] categories = PatternCategory.values();
        StorageTier[] tiers = StorageTier.values();
        for (int i = 0; i < 20_000; i++) {
            HarmonicProfile profile = new HarmonicProfile(categories[random.nextInt(categories.length)],
                    random.nextDouble(), random.nextDouble(), random.nextDouble() * 12, 1 + random.nextInt(300));
            AccessStats access = AccessStats.fresh(0L);
            long now = (long) (random.nextDouble() * 60 * DAY);
            StorageTier current = tiers[random.nextInt(tiers.length)];
            double lastScore = random.nextDouble();

            double score = router.scorer().score(profile, access, now);
            Optional<MigrationRecord> proposal = router.evaluate("p" + i, profile, access, current, lastScore, now);
            if (proposal.isEmpty()) continue;

            MigrationRecord r = proposal.get();
            assertEquals(current, r.from());
            if (score > lastScore) {
                assertFalse(current.isBetterThan(r.to()), "Higher score must never demote: " + r);
            } else if (score < lastScore) {
                assertFalse(r.to().isBetterThan(current), "Lower score must never promote: " + r);
            }
        }
    }

    @Test
    void testEvaluate_demotesAfterThirtyIdleDays() {
        HarmonicProfile profile = HarmonicProfile.of("general", 0.95, 0.95, 5.0, 50);
        AccessStats access = AccessStats.fresh(0L);
        QualityTierRouter.Assignment initial = router.assign(profile, access, 0L);

        Optional<MigrationRecord> move = router.evaluate("p", profile, access, initial.tier(), initial.score(), 30 * DAY);

        assertTrue(move.isPresent(), "Decayed pattern must migrate");
        assertEquals(StorageTier.PREMIUM, move.get().from());
        assertEquals(StorageTier.ARCHIVE, move.get().to());
        assertEquals(MigrationRecord.Reason.SCORE, move.get().reason());
        assertFalse(move.get().isPromotion());
    }

    @Test
    void testEvaluate_staysPutWhenTierMatches() {
        HarmonicProfile profile = HarmonicProfile.of("general", 0.95, 0.95, 5.0, 50);
        assertTrue(router.evaluate("p", profile, AccessStats.fresh(0L), StorageTier.PREMIUM, Double.NaN, 0L).isEmpty());
    }

    @Test
    void testRecord_updatesCountersAndHistory() {
        router.record(new MigrationRecord("a", StorageTier.STANDARD, StorageTier.PREMIUM, 0.7, 0.85,
                MigrationRecord.Reason.WARMING, 1L));
        router.record(new MigrationRecord("b", StorageTier.PREMIUM, StorageTier.ARCHIVE, 0.85, 0.5,
                MigrationRecord.Reason.SCORE, 2L));
        router.completeCycle();

        assertEquals(1, router.promotedTotal());
        assertEquals(1, router.demotedTotal());
        assertEquals(1, router.cycles());
        assertEquals(1, router.transitions(MigrationRecord.Reason.WARMING));
        assertEquals(2, router.history().size());
        assertEquals("a", router.history().get(0).patternId());
    }

    @Test
    void testAuditWindowIsBounded() {
        QualityTierRouter small = new QualityTierRouter(TierPolicy.defaults(), 2);
        for (int i = 0; i < 5; i++) {
            small.record(new MigrationRecord("p" + i, StorageTier.ARCHIVE, StorageTier.STANDARD, 0.4, 0.6,
                    MigrationRecord.Reason.SCORE, i));
        }
        assertEquals(2, small.history().size());
        assertEquals(5, small.promotedTotal());
    }
}
