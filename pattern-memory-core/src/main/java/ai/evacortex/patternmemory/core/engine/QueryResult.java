/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.engine;

import ai.evacortex.patternmemory.core.StorageTier;
import ai.evacortex.patternmemory.core.field.ProbabilityField;

import java.util.List;
import java.util.Set;

/**
 * Ranked query results.
 *
 * @param degraded     {@code true} when at least one tier did not answer
 * @param omittedTiers tiers whose candidates are missing from {@code results}
 * @param field        the field the candidates were scored against
 */
public record QueryResult(List<ScoredPattern> results,
                          boolean degraded,
                          Set<StorageTier> omittedTiers,
                          ProbabilityField field,
                          long elapsedMillis) {

    public QueryResult {
        results = List.copyOf(results);
        omittedTiers = Set.copyOf(omittedTiers);
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    public List<String> ids() {
        return results.stream().map(ScoredPattern::id).toList();
    }
}
