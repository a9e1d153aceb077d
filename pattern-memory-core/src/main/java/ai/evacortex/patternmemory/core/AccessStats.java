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
 * Access statistics of a placement. Immutable; updates produce new instances.
 *
 * @param relevance derived score kept alongside the counters, refreshed on migration
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AccessStats(long createdAt, long lastAccessAt, long accessCount, double relevance) {

    public static AccessStats fresh(long now) {
        return new AccessStats(now, now, 0, 0.0);
    }

    public AccessStats recordAccess(long now) {
        return new AccessStats(createdAt, Math.max(lastAccessAt, now), accessCount + 1, relevance);
    }

    public AccessStats withRelevance(double relevance) {
        return new AccessStats(createdAt, lastAccessAt, accessCount, relevance);
    }

    public AccessStats combine(AccessStats other) {
        return new AccessStats(Math.min(createdAt, other.createdAt),
                Math.max(lastAccessAt, other.lastAccessAt),
                accessCount + other.accessCount,
                Math.max(relevance, other.relevance));
    }
}
