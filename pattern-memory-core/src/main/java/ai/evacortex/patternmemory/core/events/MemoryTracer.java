/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.events;

import ai.evacortex.patternmemory.core.StorageTier;
import ai.evacortex.patternmemory.core.tier.MigrationRecord;
import ai.evacortex.patternmemory.core.tier.TierOutcome;

import java.util.List;

/**
 * Listener for engine events. Every callback defaults to doing nothing, so implementations
 * override only what they observe. Callbacks run on the thread that produced the event and
 * must not call back into the engine.
 */
public interface MemoryTracer {

    /**
     * @param outcome name of the {@code StoreOutcome}
     */
    default void onStored(String id, StorageTier tier, String outcome) {}

    default void onMigrated(MigrationRecord record) {}

    default void onMerged(String representativeId, List<String> removedIds) {}

    default void onEvicted(String id) {}

    default void onIntegrityEvent(String description) {}

    default void onTierDegraded(StorageTier tier, TierOutcome.Status status) {}
}
