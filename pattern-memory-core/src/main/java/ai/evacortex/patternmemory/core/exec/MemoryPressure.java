/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.exec;

/**
 * Coarse classification of sampled memory usage.
 */
public enum MemoryPressure {
    LOW, MEDIUM, HIGH, CRITICAL;

    public static final double CRITICAL_USAGE = 0.9;
    public static final double HIGH_USAGE = 0.8;
    public static final double LOW_FRACTION = 0.7;

    /**
     * @param usage     used fraction of the sampled memory in {@code [0,1]}
     * @param threshold configured memory threshold; usage below {@code 0.7 * threshold} is low
     */
    public static MemoryPressure classify(double usage, double threshold) {
        if (usage > CRITICAL_USAGE) return CRITICAL;
        if (usage > HIGH_USAGE) return HIGH;
        if (usage < LOW_FRACTION * threshold) return LOW;
        return MEDIUM;
    }
}
