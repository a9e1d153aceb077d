/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.field;

import ai.evacortex.patternmemory.core.exceptions.InvalidIntentException;
import ai.evacortex.patternmemory.core.geometry.Coordinate;

/**
 * Query-scoped scoring region. Never persisted.
 */
public record ProbabilityField(Coordinate center,
                               double radius,
                               FieldShape shape,
                               Falloff falloff,
                               double amplitude,
                               double steepness,
                               double morphingRate,
                               double contextSensitivity,
                               double explorationBias) {

    public ProbabilityField {
        if (center == null || shape == null || falloff == null) {
            throw new InvalidIntentException("center, shape and falloff are required");
        }
        if (!(radius > 0) || Double.isInfinite(radius)) {
            throw new InvalidIntentException("field radius must be finite and > 0: " + radius);
        }
        if (!(steepness > 0) || Double.isInfinite(steepness)) {
            throw new InvalidIntentException("field steepness must be finite and > 0: " + steepness);
        }
        if (!(amplitude >= 0) || Double.isInfinite(amplitude)) {
            throw new InvalidIntentException("field amplitude must be finite and >= 0: " + amplitude);
        }
    }

    public ProbabilityField withCenter(Coordinate newCenter) {
        return new ProbabilityField(newCenter, radius, shape, falloff, amplitude, steepness,
                morphingRate, contextSensitivity, explorationBias);
    }

    public ProbabilityField withRadius(double newRadius) {
        return new ProbabilityField(center, newRadius, shape, falloff, amplitude, steepness,
                morphingRate, contextSensitivity, explorationBias);
    }

    public ProbabilityField withAmplitude(double newAmplitude) {
        return new ProbabilityField(center, radius, shape, falloff, newAmplitude, steepness,
                morphingRate, contextSensitivity, explorationBias);
    }

    public ProbabilityField withSteepness(double newSteepness) {
        return new ProbabilityField(center, radius, shape, falloff, amplitude, newSteepness,
                morphingRate, contextSensitivity, explorationBias);
    }
}
