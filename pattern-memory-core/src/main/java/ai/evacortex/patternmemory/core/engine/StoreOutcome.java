/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.engine;

/**
 * Result of {@link PatternMemory#store}.
 */
public enum StoreOutcome {
    /** Written to its tier and visible to queries. */
    STORED,
    /** Folded into an existing near-duplicate, which keeps its id. */
    MERGED,
    /** The tier write failed after retries; the pattern waits in the pending-write queue. */
    QUEUED,
    /** Scored below the archive band; kept in the rejected tier and never returned by queries. */
    REJECTED_TIER
}
