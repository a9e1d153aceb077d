/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.engine;

import java.util.List;
import java.util.Set;

/**
 * Outcome of comparing the spatial index and the placement directory with a full tier scan.
 *
 * @param indexOnly            ids indexed or placed without a record in any tier
 * @param tierOnly             ids held by a query-facing tier but missing from the index or directory
 * @param misplaced            ids whose directory tier differs from the tier holding them, or held by two tiers
 * @param structuralViolations broken R-tree invariants
 * @param rebuilt              whether the directory and index were rebuilt from the scan
 */
public record ConsistencyReport(Set<String> indexOnly,
                                Set<String> tierOnly,
                                Set<String> misplaced,
                                List<String> structuralViolations,
                                boolean rebuilt) {

    public ConsistencyReport {
        indexOnly = Set.copyOf(indexOnly);
        tierOnly = Set.copyOf(tierOnly);
        misplaced = Set.copyOf(misplaced);
        structuralViolations = List.copyOf(structuralViolations);
    }

    public boolean isConsistent() {
        return indexOnly.isEmpty() && tierOnly.isEmpty() && misplaced.isEmpty() && structuralViolations.isEmpty();
    }

    @Override
    public String toString() {
        return "ConsistencyReport[indexOnly=" + indexOnly.size() + ", tierOnly=" + tierOnly.size()
                + ", misplaced=" + misplaced.size() + ", violations=" + structuralViolations.size()
                + ", rebuilt=" + rebuilt + "]";
    }
}
