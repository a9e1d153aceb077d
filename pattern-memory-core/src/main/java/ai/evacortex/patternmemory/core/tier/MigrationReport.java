/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.tier;

/**
 * @param promoted       transitions to a better tier in this cycle
 * @param demoted        transitions to a worse tier in this cycle
 * @param cycles         cycles run since the engine started, including this one
 * @param evaluated      placements re-scored in this cycle
 * @param durationMillis wall time of this cycle
 */
public record MigrationReport(int promoted, int demoted, long cycles, int evaluated, long durationMillis) {
}
