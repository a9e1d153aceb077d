/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.engine;

import ai.evacortex.patternmemory.core.StorageTier;
import ai.evacortex.patternmemory.core.cache.MaterializerStats;
import ai.evacortex.patternmemory.core.cache.WarmingStats;
import ai.evacortex.patternmemory.core.index.IndexStats;

import java.util.Map;

/**
 * @param tierCounts      placements per tier, from the placement directory
 * @param migrations      tier transitions applied since the engine was opened
 * @param pendingWrites   patterns waiting for a successful tier write
 */
public record EngineStats(Map<StorageTier, Integer> tierCounts,
                          IndexStats indexStats,
                          WarmingStats warmingStats,
                          MaterializerStats materializerStats,
                          long migrations,
                          long migrationCycles,
                          long dedupRuns,
                          int pendingWrites) {

    public EngineStats {
        tierCounts = Map.copyOf(tierCounts);
    }

    public int totalPatterns() {
        return tierCounts.values().stream().mapToInt(Integer::intValue).sum();
    }
}
