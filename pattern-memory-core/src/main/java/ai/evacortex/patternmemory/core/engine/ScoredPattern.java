/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.engine;

import ai.evacortex.patternmemory.core.Pattern;
import ai.evacortex.patternmemory.core.StorageTier;

/**
 * A pattern returned by a query.
 *
 * @param score    field probability after filter boosts, in (0,1]
 * @param distance Euclidean distance from the field center
 */
public record ScoredPattern(Pattern pattern, StorageTier tier, double score, double distance) {

    public String id() {
        return pattern.id();
    }
}
