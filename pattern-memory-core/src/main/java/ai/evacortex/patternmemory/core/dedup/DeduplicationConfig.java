/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.dedup;

/**
 * @param candidateRadius     coordinate distance within which two patterns are compared
 * @param similarityThreshold minimum similarity for two patterns to be considered duplicates
 */
public record DeduplicationConfig(double candidateRadius,
                                  double similarityThreshold,
                                  double textWeight,
                                  double structuralWeight,
                                  double locationWeight,
                                  double propertyWeight) {

    public DeduplicationConfig {
        if (!(candidateRadius > 0)) throw new IllegalArgumentException("candidateRadius must be > 0");
        if (!(similarityThreshold > 0 && similarityThreshold <= 1)) {
            throw new IllegalArgumentException("similarityThreshold must be in (0,1]");
        }
        if (textWeight + structuralWeight + locationWeight + propertyWeight <= 0) {
            throw new IllegalArgumentException("similarity weights must not all be zero");
        }
    }

    public static DeduplicationConfig defaults() {
        return new DeduplicationConfig(0.1, 0.9, 0.4, 0.3, 0.3, 0.2);
    }

    public DeduplicationConfig withThreshold(double threshold) {
        return new DeduplicationConfig(candidateRadius, threshold, textWeight, structuralWeight,
                locationWeight, propertyWeight);
    }

    public DeduplicationConfig withRadius(double radius) {
        return new DeduplicationConfig(radius, similarityThreshold, textWeight, structuralWeight,
                locationWeight, propertyWeight);
    }
}
