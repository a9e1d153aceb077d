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

/**
 * A tier backend cannot serve a request. Reads and writes turn it into a degraded
 * {@code TierOutcome}; it reaches callers only when a tier cannot be opened or scanned, or an
 * eviction cannot delete the record.
 */
public class TierUnavailableException extends RuntimeException {

    private final StorageTier tier;

    public TierUnavailableException(StorageTier tier, String message) {
        super("Tier " + tier + " unavailable: " + message);
        this.tier = tier;
    }

    public TierUnavailableException(StorageTier tier, String message, Throwable cause) {
        super("Tier " + tier + " unavailable: " + message, cause);
        this.tier = tier;
    }

    public StorageTier tier() {
        return tier;
    }
}
