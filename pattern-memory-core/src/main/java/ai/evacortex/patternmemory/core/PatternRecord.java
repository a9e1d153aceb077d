/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Unit persisted by a tier backend: the pattern plus its placement attributes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PatternRecord(Pattern pattern, StorageTier tier, AccessStats access) {

    public String id() {
        return pattern.id();
    }

    public PatternRecord withTier(StorageTier newTier) {
        return new PatternRecord(pattern, newTier, access);
    }

    public PatternRecord withAccess(AccessStats newAccess) {
        return new PatternRecord(pattern, tier, newAccess);
    }
}
