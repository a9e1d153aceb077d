/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.index;

/**
 * Structural statistics of a spatial index.
 *
 * @param size                number of indexed entries
 * @param nodeCount           internal plus leaf nodes
 * @param leafCount           leaf nodes
 * @param height              levels from root to leaves, 1 for a single leaf root, 0 when empty
 * @param avgOccupancy        mean number of slots used per node
 * @param lastQueryNodeVisits nodes visited by the most recent range or k-NN query
 * @param linearScan          whether queries currently bypass the tree
 */
public record IndexStats(int size,
                         int nodeCount,
                         int leafCount,
                         int height,
                         double avgOccupancy,
                         int lastQueryNodeVisits,
                         boolean linearScan) {
}
