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
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

/**
 * Opaque task execution service with per-task timeouts.
 */
public interface TaskExecutor {

    /**
     * Runs {@code task} on a worker. The returned future completes exceptionally with
     * {@link java.util.concurrent.TimeoutException} if the task does not finish within
     * {@code timeout} of submission, and with
     * {@link java.util.concurrent.RejectedExecutionException} if the executor shuts down first.
     */
    <T> CompletableFuture<T> submit(Callable<T> task, Duration timeout);

    <T> CompletableFuture<T> submit(Callable<T> task);

    int activeWorkers();

    /**
     * Rejects new and queued work, waits up to {@code grace} for running tasks and then
     * interrupts the ones still running.
     */
    void shutdown(Duration grace);
}
