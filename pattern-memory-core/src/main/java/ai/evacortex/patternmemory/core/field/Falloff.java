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
 * Weight of a point at distance {@code d} inside a field of radius {@code r}.
 */
public enum Falloff {

    /** {@code a * e^(-k*d)} */
    EXPONENTIAL {
        @Override
        public double apply(double d, double r, double amplitude, double steepness) {
            return amplitude * Math.exp(-steepness * d);
        }
    },

    /** {@code a * (1 - d/r)^k} */
    POLYNOMIAL {
        @Override
        public double apply(double d, double r, double amplitude, double steepness) {
            return amplitude * Math.pow(Math.max(0.0, 1.0 - d / r), steepness);
        }
    },

    /** {@code a * e^(-d^2 / 2s^2)} with {@code s = r / 2k} */
    GAUSSIAN {
        @Override
        public double apply(double d, double r, double amplitude, double steepness) {
            double sigma = r / (2.0 * steepness);
            return amplitude * Math.exp(-(d * d) / (2.0 * sigma * sigma));
        }
    },

    /** {@code a / (1 + e^((d - r/2) * k))} */
    SIGMOID {
        @Override
        public double apply(double d, double r, double amplitude, double steepness) {
            return amplitude / (1.0 + Math.exp((d - r / 2.0) * steepness));
        }
    };

    public abstract double apply(double d, double r, double amplitude, double steepness);
}
