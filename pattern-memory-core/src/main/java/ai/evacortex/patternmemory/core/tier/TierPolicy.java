/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.tier;

import ai.evacortex.patternmemory.core.PatternCategory;
import ai.evacortex.patternmemory.core.StorageTier;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Score bands and scoring parameters of the tier router.
 *
 * @param premiumThreshold  minimum score for {@link StorageTier#PREMIUM}
 * @param standardThreshold minimum score for {@link StorageTier#STANDARD}
 * @param archiveThreshold  minimum score for {@link StorageTier#ARCHIVE}; below it a pattern is rejected
 * @param recencyWeight     share of the score that decays with idle time, in [0,1]
 * @param recencyHalfLife   idle time after which the decaying share is halved
 */
public record TierPolicy(double premiumThreshold,
                         double standardThreshold,
                         double archiveThreshold,
                         QualityWeights defaultWeights,
                         Map<PatternCategory, QualityWeights> categoryWeights,
                         double recencyWeight,
                         Duration recencyHalfLife,
                         double complexityCap,
                         double occurrenceSaturation) {

    public TierPolicy {
        if (!(premiumThreshold > standardThreshold && standardThreshold > archiveThreshold && archiveThreshold > 0
                && premiumThreshold <= 1.0)) {
            throw new IllegalArgumentException("Tier thresholds must satisfy 1 >= premium > standard > archive > 0");
        }
        if (recencyWeight < 0 || recencyWeight > 1) {
            throw new IllegalArgumentException("recencyWeight must be in [0,1]: " + recencyWeight);
        }
        if (recencyHalfLife == null || recencyHalfLife.isZero() || recencyHalfLife.isNegative()) {
            throw new IllegalArgumentException("recencyHalfLife must be positive");
        }
        if (!(complexityCap > 0) || !(occurrenceSaturation > 1)) {
            throw new IllegalArgumentException("complexityCap must be > 0 and occurrenceSaturation > 1");
        }
        defaultWeights = defaultWeights == null ? QualityWeights.defaults() : defaultWeights;
        categoryWeights = categoryWeights == null || categoryWeights.isEmpty()
                ? Map.of() : Map.copyOf(new EnumMap<>(categoryWeights));
    }

    public static TierPolicy defaults() {
        Map<PatternCategory, QualityWeights> perCategory = new EnumMap<>(PatternCategory.class);
        perCategory.put(PatternCategory.AUTHENTICATION, QualityWeights.securitySensitive());
        perCategory.put(PatternCategory.AUTHORIZATION, QualityWeights.securitySensitive());
        perCategory.put(PatternCategory.SECURITY, QualityWeights.securitySensitive());
        perCategory.put(PatternCategory.CRYPTOGRAPHIC, QualityWeights.securitySensitive());
        return new TierPolicy(0.80, 0.60, 0.35, QualityWeights.defaults(), perCategory,
                0.4, Duration.ofDays(7), 10.0, 100.0);
    }

    public QualityWeights weightsFor(PatternCategory category) {
        return categoryWeights.getOrDefault(category, defaultWeights);
    }

    /** Monotonic in {@code score}: a higher score never maps to a worse tier. */
    public StorageTier tierFor(double score) {
        if (score >= premiumThreshold) return StorageTier.PREMIUM;
        if (score >= standardThreshold) return StorageTier.STANDARD;
        if (score >= archiveThreshold) return StorageTier.ARCHIVE;
        return StorageTier.REJECTED;
    }
}
