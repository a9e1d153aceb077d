/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.cache;

/**
 * Snapshot of cache-warming activity.
 *
 * @param patternsWarmed       patterns made resident or promoted, summed over all cycles
 * @param cycles               completed {@code warmCache()} runs
 * @param cumulativeTimeMillis time spent warming, summed over all cycles
 * @param hotCacheSize         current number of resident records
 * @param hitRate              hot-cache hit rate since creation
 */
public record WarmingStats(long patternsWarmed, long cycles, long cumulativeTimeMillis,
                           long hotCacheSize, double hitRate) {

    public static final WarmingStats EMPTY = new WarmingStats(0, 0, 0, 0, 0.0);
}
