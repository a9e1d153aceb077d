/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core;

import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Semantic category of a pattern. Categories that share a neighborhood on the X axis
 * (security, data, structure, computation, error handling) are placed close to each other
 * by {@link ai.evacortex.patternmemory.core.geometry.CoordinateHasher}.
 */
public enum PatternCategory {

    AUTHENTICATION(0.15),
    AUTHORIZATION(0.16),
    SECURITY(0.17),
    CRYPTOGRAPHIC(0.18),
    DATA_FLOW(0.35),
    STATE_MANAGEMENT(0.38),
    STRUCTURAL(0.55),
    BEHAVIORAL(0.58),
    COMPUTATIONAL(0.75),
    FUNCTIONAL(0.78),
    ERROR_PATTERN(0.92),
    RECOVERY(0.95),
    FRACTAL(Double.NaN),
    WAVE(Double.NaN),
    INFORMATION_THEORY(Double.NaN),
    TOPOLOGICAL(Double.NaN),
    GEOMETRIC(Double.NaN),
    TILING(Double.NaN),
    CLASSICAL_HARMONY(Double.NaN),
    GENERAL(Double.NaN);

    private static final Map<String, PatternCategory> ALIASES = Map.ofEntries(
            Map.entry("AUTH", AUTHENTICATION),
            Map.entry("AUTHN", AUTHENTICATION),
            Map.entry("AUTHZ", AUTHORIZATION),
            Map.entry("CRYPTO", CRYPTOGRAPHIC),
            Map.entry("DATAFLOW", DATA_FLOW),
            Map.entry("STATE", STATE_MANAGEMENT),
            Map.entry("ERROR", ERROR_PATTERN),
            Map.entry("ERRORS", ERROR_PATTERN),
            Map.entry("HARMONIC", GENERAL)
    );

    /** Neighborhood position on [0,1]; NaN when the category has no fixed neighborhood. */
    private final double neighborhood;

    PatternCategory(double neighborhood) {
        this.neighborhood = neighborhood;
    }

    public OptionalDouble neighborhood() {
        return Double.isNaN(neighborhood) ? OptionalDouble.empty() : OptionalDouble.of(neighborhood);
    }

    /**
     * Lenient lookup: case-insensitive, accepts short aliases ({@code "auth"}),
     * dashes or spaces for underscores, and falls back to {@link #GENERAL}.
     */
    public static PatternCategory of(String name) {
        if (name == null || name.isBlank()) return GENERAL;
        String key = name.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        PatternCategory alias = ALIASES.get(key);
        if (alias != null) return alias;
        for (PatternCategory c : values()) {
            if (c.name().equals(key)) return c;
        }
        return GENERAL;
    }
}
