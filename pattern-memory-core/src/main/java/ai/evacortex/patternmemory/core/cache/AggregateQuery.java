/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.cache;

import java.util.EnumSet;
import java.util.Set;

/**
 * Built-in aggregate queries the engine can answer from its placements.
 */
public enum AggregateQuery {

    /** Pattern count per category. */
    CATEGORY_DISTRIBUTION(EnumSet.of(QueryMaterializer.Dependency.PATTERNS)),

    /** Pattern count per storage tier. */
    TIER_DISTRIBUTION(EnumSet.of(QueryMaterializer.Dependency.PATTERNS, QueryMaterializer.Dependency.TIERS)),

    /** Files ranked by the summed complexity of the patterns located in them. */
    COMPLEXITY_HOTSPOTS(EnumSet.of(QueryMaterializer.Dependency.PATTERNS)),

    /** Patterns located in at least three distinct files. */
    CROSS_CUTTING(EnumSet.of(QueryMaterializer.Dependency.PATTERNS));

    public static final int CROSS_CUTTING_MIN_FILES = 3;

    private final Set<QueryMaterializer.Dependency> dependencies;

    AggregateQuery(Set<QueryMaterializer.Dependency> dependencies) {
        this.dependencies = dependencies;
    }

    public Set<QueryMaterializer.Dependency> dependencies() {
        return EnumSet.copyOf(dependencies);
    }
}
