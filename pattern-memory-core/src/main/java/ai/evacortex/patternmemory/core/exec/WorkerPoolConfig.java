/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.exec;

import java.time.Duration;

/**
 * @param floor           minimum number of workers while the pool runs
 * @param ceiling         maximum number of workers
 * @param sampleInterval  period of the memory monitor; zero disables it
 * @param memoryThreshold usage threshold used to classify {@link MemoryPressure#LOW}
 * @param defaultTimeout  timeout applied by {@link TaskExecutor#submit(java.util.concurrent.Callable)}
 */
public record WorkerPoolConfig(int floor, int ceiling, Duration sampleInterval,
                               double memoryThreshold, Duration defaultTimeout) {

    public WorkerPoolConfig {
        if (floor < 1) throw new IllegalArgumentException("floor must be >= 1");
        if (ceiling < floor) throw new IllegalArgumentException("ceiling must be >= floor");
        if (sampleInterval.isNegative()) throw new IllegalArgumentException("sampleInterval must be >= 0");
        if (!(memoryThreshold > 0 && memoryThreshold <= 1)) {
            throw new IllegalArgumentException("memoryThreshold must be in (0,1]");
        }
        if (defaultTimeout.isNegative() || defaultTimeout.isZero()) {
            throw new IllegalArgumentException("defaultTimeout must be > 0");
        }
    }

    public static WorkerPoolConfig defaults() {
        int cpus = Runtime.getRuntime().availableProcessors();
        return new WorkerPoolConfig(2, Math.max(2, cpus), Duration.ofSeconds(1), 0.8, Duration.ofSeconds(30));
    }
}
