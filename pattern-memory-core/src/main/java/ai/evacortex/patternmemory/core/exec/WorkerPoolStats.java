/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.exec;

public record WorkerPoolStats(int poolSize,
                              int coreSize,
                              int active,
                              int queued,
                              long completed,
                              long timedOut,
                              long rejected,
                              MemoryPressure lastPressure) {}
