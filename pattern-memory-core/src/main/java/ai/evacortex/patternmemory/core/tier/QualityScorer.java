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

/**
 * Quality score in [0,1]: a weighted mix of strength, confidence, complexity and occurrences,
 * multiplied by a recency factor that decays with idle time.
 */
public class QualityScorer {

    private static final double MILLIS_PER_DAY = 86_400_000.0;

    private final TierPolicy policy;

    public QualityScorer(TierPolicy policy) {
        this.policy = policy;
    }

    public double score(HarmonicProfile profile, AccessStats access, long now) {
        return clamp(baseScore(profile) * recencyMultiplier(access, now));
    }

    public double baseScore(HarmonicProfile profile) {
        QualityWeights w = policy.weightsFor(profile.category());
        double complexity = Math.min(1.0, profile.complexity() / policy.complexityCap());
        double occurrences = Math.min(1.0,
                Math.log10(profile.occurrences()) / Math.log10(policy.occurrenceSaturation()));
        double weighted = w.strength() * profile.strength()
                + w.confidence() * profile.confidence()
                + w.complexity() * complexity
                + w.occurrences() * occurrences;
        return clamp(weighted / w.total());
    }

    /**
     * {@code 1 - w * (1 - 0.5^(idle / halfLife))}: 1 for a pattern touched just now,
     * approaching {@code 1 - w} as it stays idle.
     */
    public double recencyMultiplier(AccessStats access, long now) {
        if (access == null) return 1.0;
        long lastTouch = Math.max(access.lastAccessAt(), access.createdAt());
        double idleDays = Math.max(0L, now - lastTouch) / MILLIS_PER_DAY;
        double halfLifeDays = policy.recencyHalfLife().toMillis() / MILLIS_PER_DAY;
        double decay = 1.0 - Math.pow(0.5, idleDays / halfLifeDays);
        return 1.0 - policy.recencyWeight() * decay;
    }

    public TierPolicy policy() {
        return policy;
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
