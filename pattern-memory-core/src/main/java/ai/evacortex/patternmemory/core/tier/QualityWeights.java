/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.tier;

/**
 * Relative weights of the quality features. They are normalized by their sum when applied.
 */
public record QualityWeights(double strength, double confidence, double complexity, double occurrences) {

    public QualityWeights {
        if (strength < 0 || confidence < 0 || complexity < 0 || occurrences < 0) {
            throw new IllegalArgumentException("Quality weights must be >= 0");
        }
        if (strength + confidence + complexity + occurrences <= 0) {
            throw new IllegalArgumentException("At least one quality weight must be positive");
        }
    }

    public static QualityWeights defaults() {
        return new QualityWeights(0.40, 0.30, 0.10, 0.20);
    }

    /** Security-sensitive categories trust the detector's confidence more than raw strength. */
    public static QualityWeights securitySensitive() {
        return new QualityWeights(0.35, 0.40, 0.10, 0.15);
    }

    public double total() {
        return strength + confidence + complexity + occurrences;
    }
}
