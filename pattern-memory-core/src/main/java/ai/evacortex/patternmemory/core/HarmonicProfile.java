/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core;

import ai.evacortex.patternmemory.core.exceptions.InvalidPatternException;

/**
 * Semantic profile of a pattern. The coordinate of a pattern is a pure function of this record.
 *
 * @param category    semantic category
 * @param strength    detection strength in [0,1]
 * @param confidence  detector confidence in [0,1]
 * @param complexity  non-negative complexity measure
 * @param occurrences number of sightings, at least 1
 */
public record HarmonicProfile(PatternCategory category,
                              double strength,
                              double confidence,
                              double complexity,
                              int occurrences) {

    public HarmonicProfile {
        if (category == null) throw new InvalidPatternException("category must not be null");
        if (!(strength >= 0.0 && strength <= 1.0)) {
            throw new InvalidPatternException("strength must be in [0,1]: " + strength);
        }
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new InvalidPatternException("confidence must be in [0,1]: " + confidence);
        }
        if (!(complexity >= 0.0) || Double.isInfinite(complexity)) {
            throw new InvalidPatternException("complexity must be finite and >= 0: " + complexity);
        }
        if (occurrences < 1) throw new InvalidPatternException("occurrences must be >= 1: " + occurrences);
    }

    public static HarmonicProfile of(String category, double strength, double confidence,
                                     double complexity, int occurrences) {
        return new HarmonicProfile(PatternCategory.of(category), strength, confidence, complexity, occurrences);
    }

    public HarmonicProfile withOccurrences(int occurrences) {
        return new HarmonicProfile(category, strength, confidence, complexity, occurrences);
    }
}
