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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Writes every event to the {@code ai.evacortex.patternmemory.events} logger.
 */
public class LoggingTracer implements MemoryTracer {

    private static final Logger log = LoggerFactory.getLogger("ai.evacortex.patternmemory.events");

    @Override
    public void onStored(String id, StorageTier tier, String outcome) {
        log.debug("stored {} in {} ({})", id, tier, outcome);
    }

    @Override
    public void onMigrated(MigrationRecord record) {
        log.info("migrated {} {} -> {} ({}, score {} -> {})", record.patternId(), record.from(), record.to(),
                record.reason(), String.format("%.3f", record.previousScore()), String.format("%.3f", record.score()));
    }

    @Override
    public void onMerged(String representativeId, List<String> removedIds) {
        log.info("merged {} into {}", removedIds, representativeId);
    }

    @Override
    public void onEvicted(String id) {
        log.debug("evicted {}", id);
    }

    @Override
    public void onIntegrityEvent(String description) {
        log.warn("integrity: {}", description);
    }

    @Override
    public void onTierDegraded(StorageTier tier, TierOutcome.Status status) {
        log.warn("tier {} degraded: {}", tier, status);
    }
}
