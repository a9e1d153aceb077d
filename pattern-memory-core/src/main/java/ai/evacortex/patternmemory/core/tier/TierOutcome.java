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
 * Typed result of a tier operation. Backend exceptions are folded into
 * {@link Status#UNAVAILABLE} or {@link Status#TIMEOUT}.
 */
public record TierOutcome<T>(StorageTier tier, Status status, T value, String detail) {

    public enum Status { OK, NOT_FOUND, UNAVAILABLE, TIMEOUT }

    public static <T> TierOutcome<T> ok(StorageTier tier, T value) {
        return new TierOutcome<>(tier, Status.OK, value, null);
    }

    public static <T> TierOutcome<T> notFound(StorageTier tier) {
        return new TierOutcome<>(tier, Status.NOT_FOUND, null, null);
    }

    public static <T> TierOutcome<T> unavailable(StorageTier tier, String detail) {
        return new TierOutcome<>(tier, Status.UNAVAILABLE, null, detail);
    }

    public static <T> TierOutcome<T> timeout(StorageTier tier) {
        return new TierOutcome<>(tier, Status.TIMEOUT, null, "timed out");
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public boolean isFailure() {
        return status == Status.UNAVAILABLE || status == Status.TIMEOUT;
    }
}
