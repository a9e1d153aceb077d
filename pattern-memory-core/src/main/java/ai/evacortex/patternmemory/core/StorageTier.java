/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core;

/**
 * Cost/performance class of a pattern placement, best first.
 */
public enum StorageTier {

    PREMIUM(3),
    STANDARD(2),
    ARCHIVE(1),
    REJECTED(0);

    private final int rank;

    StorageTier(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public boolean isBetterThan(StorageTier other) {
        return rank > other.rank;
    }

    /** Rejected placements are kept as metadata only and never answer queries. */
    public boolean isQueryFacing() {
        return this != REJECTED;
    }
}
