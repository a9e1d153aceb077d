/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.index;

import java.util.Comparator;

/**
 * Result entry of a nearest-neighbour search.
 */
public record Neighbor(String id, double distance) {

    /** Ascending distance, ties broken by id so results are reproducible. */
    public static final Comparator<Neighbor> ORDER =
            Comparator.comparingDouble(Neighbor::distance).thenComparing(Neighbor::id);
}
