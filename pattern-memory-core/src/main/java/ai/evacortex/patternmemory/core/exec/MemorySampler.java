/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.exec;

/**
 * Source of memory usage samples for {@link AdaptiveWorkerPool}.
 */
@FunctionalInterface
public interface MemorySampler {

    /**
     * @return used fraction in {@code [0,1]}
     */
    double usage();

    /**
     * Heap used divided by the maximum heap the JVM will attempt to use.
     */
    static MemorySampler heap() {
        return () -> {
            Runtime rt = Runtime.getRuntime();
            long used = rt.totalMemory() - rt.freeMemory();
            return (double) used / rt.maxMemory();
        };
    }
}
