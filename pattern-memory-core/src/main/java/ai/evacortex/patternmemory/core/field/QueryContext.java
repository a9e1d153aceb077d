/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.field;

import ai.evacortex.patternmemory.core.PatternCategory;

import java.util.List;

/**
 * Snapshot of recent query activity used to adapt field geometry.
 *
 * @param samples number of queries the snapshot was built from; hit rate is ignored when 0
 */
public record QueryContext(List<QueryType> recentQueryTypes,
                           List<PatternCategory> recentCategories,
                           double averageResponseMillis,
                           double hitRate,
                           int samples) {

    public static final QueryContext EMPTY = new QueryContext(List.of(), List.of(), 0.0, 0.0, 0);

    public QueryContext {
        recentQueryTypes = recentQueryTypes == null ? List.of() : List.copyOf(recentQueryTypes);
        recentCategories = recentCategories == null ? List.of() : List.copyOf(recentCategories);
    }

    public boolean hasHistory() {
        return samples > 0;
    }

    public long categoryFrequency(PatternCategory category) {
        return recentCategories.stream().filter(c -> c == category).count();
    }
}
