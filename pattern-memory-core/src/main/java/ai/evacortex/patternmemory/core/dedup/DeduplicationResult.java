/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.dedup;

/**
 * Summary of one deduplication run. Never mutated after creation.
 *
 * @param candidatesFound   pairs confirmed as duplicates
 * @param merged            patterns absorbed into a representative
 * @param spaceSaved        serialized bytes of the absorbed patterns
 * @param processingTimeMs  wall time of the run
 */
public record DeduplicationResult(int candidatesFound, int merged, long spaceSaved, long processingTimeMs) {

    public static final DeduplicationResult EMPTY = new DeduplicationResult(0, 0, 0, 0);
}
