/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.cache;

import java.util.Map;

/**
 * @param accessCounts requests seen per query signature, materialized or not
 */
public record MaterializerStats(int viewCount, long hits, long misses, Map<String, Long> accessCounts) {

    public MaterializerStats {
        accessCounts = Map.copyOf(accessCounts);
    }
}
