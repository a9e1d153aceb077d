/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.exceptions;

import ai.evacortex.patternmemory.core.StorageTier;

import java.util.Set;

/**
 * Every tier consulted by a request failed or timed out, so no partial answer exists.
 */
public class TierExhaustedException extends RuntimeException {

    private final Set<StorageTier> failedTiers;

    public TierExhaustedException(Set<StorageTier> failedTiers) {
        super("All consulted tiers failed: " + failedTiers);
        this.failedTiers = Set.copyOf(failedTiers);
    }

    public Set<StorageTier> failedTiers() {
        return failedTiers;
    }
}
