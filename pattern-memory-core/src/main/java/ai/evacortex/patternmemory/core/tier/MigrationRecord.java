/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.tier;

import ai.evacortex.patternmemory.core.StorageTier;

/**
 * One tier transition. Never mutated after creation.
 */
public record MigrationRecord(String patternId,
                              StorageTier from,
                              StorageTier to,
                              double previousScore,
                              double score,
                              Reason reason,
                              long timestamp) {

    public enum Reason {
        /** Score crossed a band boundary during a migration cycle. */
        SCORE,
        /** Promoted ahead of demand by the cache warmer. */
        WARMING,
        /** Re-placed after absorbing a duplicate. */
        MERGE
    }

    public boolean isPromotion() {
        return to.isBetterThan(from);
    }
}
