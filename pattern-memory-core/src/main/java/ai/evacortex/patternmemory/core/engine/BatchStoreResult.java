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

public record BatchStoreResult(int stored, int merged, int queued, int rejected, int failed, List<Failure> failures) {

    /**
     * @param position index of the offending pattern in the submitted batch
     */
    public record Failure(int position, String reason) {}

    public BatchStoreResult {
        failures = List.copyOf(failures);
    }

    public int total() {
        return stored + merged + queued + rejected + failed;
    }
}
