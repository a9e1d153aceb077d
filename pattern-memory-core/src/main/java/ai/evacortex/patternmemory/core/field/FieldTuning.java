/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.field;

/**
 * Numeric knobs of {@link ProbabilityFieldEngine}. The defaults reproduce the observed
 * behaviour of the field generator; none of them is a derived constant.
 */
public record FieldTuning(Geometry precision,
                          Geometry discovery,
                          CreativeRange creative,
                          Adjustments adjustments,
                          double baseMorphingRate,
                          double ellipticalStretch,
                          int fractalOctaves,
                          double adaptiveSensitivityThreshold,
                          double minRadius,
                          double maxRadius) {

    /**
     * Base geometry of a query type: {@code radius = baseRadius + factor * radiusSpan}, where
     * the factor is {@code 1 - confidence} for precision and {@code exploration} for discovery.
     */
    public record Geometry(double baseRadius, double radiusSpan, double amplitude, double steepness) {}

    public record CreativeRange(double minRadius, double maxRadius,
                                double minAmplitude, double maxAmplitude,
                                double minSteepness, double maxSteepness) {}

    public record Adjustments(double lowConfidence, double lowConfidenceRadius, double lowConfidenceAmplitude,
                              double highConfidence, double highConfidenceRadius, double highConfidenceAmplitude,
                              long urgentMillis, double urgentRadius, double urgentSteepness,
                              double lowHitRate, double lowHitRateRadius,
                              double highHitRate, double highHitRateRadius) {}

    public FieldTuning {
        if (!(minRadius > 0) || maxRadius < minRadius) {
            throw new IllegalArgumentException("Invalid radius bounds [" + minRadius + ", " + maxRadius + "]");
        }
        if (fractalOctaves < 1) throw new IllegalArgumentException("fractalOctaves must be >= 1");
    }

    public static FieldTuning defaults() {
        return new FieldTuning(
                new Geometry(0.1, 0.2, 1.5, 4.0),
                new Geometry(0.5, 0.3, 1.0, 1.5),
                new CreativeRange(0.6, 0.8, 0.8, 1.2, 1.0, 3.0),
                new Adjustments(
                        0.3, 1.5, 0.8,
                        0.8, 0.7, 1.2,
                        100, 0.8, 1.2,
                        0.5, 1.2,
                        0.9, 0.9),
                0.1,
                0.3,
                3,
                0.75,
                0.01,
                2 * Math.sqrt(3));
    }
}
