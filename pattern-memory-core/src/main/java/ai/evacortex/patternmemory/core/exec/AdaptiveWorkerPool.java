/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Worker pool that scales its core size between a floor and a ceiling from sampled memory
 * pressure.
 *
 * <p>Core threads are prestarted and never time out, so the pool holds at least {@code floor}
 * workers while it runs. A monitor adds a worker when pressure is low and work is queued, and
 * removes one or two under high or critical pressure.</p>
 */
public class AdaptiveWorkerPool implements TaskExecutor, Closeable {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveWorkerPool.class);

    private final WorkerPoolConfig config;
    private final MemorySampler sampler;
    private final ThreadPoolExecutor executor;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong timedOut = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private volatile MemoryPressure lastPressure = MemoryPressure.MEDIUM;

    public AdaptiveWorkerPool(WorkerPoolConfig config) {
        this(config, MemorySampler.heap());
    }

    public AdaptiveWorkerPool(WorkerPoolConfig config, MemorySampler sampler) {
        this.config = config;
        this.sampler = sampler;
        this.executor = new ThreadPoolExecutor(config.floor(), config.ceiling(), 60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), namedFactory("pattern-memory-worker"));
        this.executor.prestartAllCoreThreads();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(namedFactory("pattern-memory-pool-monitor"));
        long interval = config.sampleInterval().toMillis();
        if (interval > 0) {
            scheduler.scheduleAtFixedRate(this::monitor, interval, interval, TimeUnit.MILLISECONDS);
        }
    }

    @Override
    public <T> CompletableFuture<T> submit(Callable<T> task) {
        return submit(task, config.defaultTimeout());
    }

    @Override
    public <T> CompletableFuture<T> submit(Callable<T> task, Duration timeout) {
        if (closed.get()) {
            rejected.incrementAndGet();
            return CompletableFuture.failedFuture(new RejectedExecutionException("worker pool is shut down"));
        }
        Task<T> wrapped = new Task<>(task);
        try {
            executor.execute(wrapped);
        } catch (RejectedExecutionException e) {
            rejected.incrementAndGet();
            return CompletableFuture.failedFuture(e);
        }
        ScheduledFuture<?> timer;
        try {
            timer = scheduler.schedule(() -> wrapped.expire(timeout), timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            wrapped.result.completeExceptionally(e);
            return wrapped.result;
        }
        wrapped.result.whenComplete((v, err) -> timer.cancel(false));
        return wrapped.result;
    }

    @Override
    public int activeWorkers() {
        return executor.getActiveCount();
    }

    public int poolSize() {
        return executor.getPoolSize();
    }

    public int coreSize() {
        return executor.getCorePoolSize();
    }

    /**
     * Samples memory once and resizes the pool accordingly.
     */
    public MemoryPressure adjustNow() {
        MemoryPressure pressure = MemoryPressure.classify(sampler.usage(), config.memoryThreshold());
        lastPressure = pressure;
        int core = executor.getCorePoolSize();
        int target = switch (pressure) {
            case LOW -> executor.getQueue().isEmpty() ? core : core + 1;
            case MEDIUM -> core;
            case HIGH -> core - 1;
            case CRITICAL -> core - 2;
        };
        resize(target);
        return pressure;
    }

    @Override
    public void shutdown(Duration grace) {
        if (!closed.compareAndSet(false, true)) return;
        scheduler.shutdownNow();
        executor.shutdown();

        List<Runnable> queued = new ArrayList<>();
        executor.getQueue().drainTo(queued);
        for (Runnable r : queued) {
            if (r instanceof Task<?> t) {
                t.result.completeExceptionally(new RejectedExecutionException("worker pool shut down before task started"));
                rejected.incrementAndGet();
            }
        }
        try {
            if (!executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                List<Runnable> stragglers = executor.shutdownNow();
                log.warn("Worker pool forced shutdown after {} ms ({} tasks never started)",
                        grace.toMillis(), stragglers.size());
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        shutdown(Duration.ofSeconds(5));
    }

    public boolean isShutdown() {
        return closed.get();
    }

    public WorkerPoolStats stats() {
        return new WorkerPoolStats(executor.getPoolSize(), executor.getCorePoolSize(), executor.getActiveCount(),
                executor.getQueue().size(), completed.get(), timedOut.get(), rejected.get(), lastPressure);
    }

    private void monitor() {
        try {
            adjustNow();
        } catch (RuntimeException e) {
            log.warn("Memory monitor failed: {}", e.toString());
        }
    }

    private synchronized void resize(int target) {
        if (closed.get()) return;
        int clamped = Math.max(config.floor(), Math.min(config.ceiling(), target));
        int current = executor.getCorePoolSize();
        if (clamped == current) return;
        executor.setCorePoolSize(clamped);
        if (clamped > current) executor.prestartCoreThread();
        log.debug("Worker pool resized {} -> {} ({})", current, clamped, lastPressure);
    }

    private static ThreadFactory namedFactory(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private final class Task<T> implements Runnable {
        final CompletableFuture<T> result = new CompletableFuture<>();
        private final Callable<T> callable;
        private Thread runner;

        Task(Callable<T> callable) {
            this.callable = callable;
        }

        @Override
        public void run() {
            synchronized (this) {
                if (result.isDone()) return;
                runner = Thread.currentThread();
            }
            try {
                T value = callable.call();
                if (result.complete(value)) completed.incrementAndGet();
            } catch (Exception e) {
                result.completeExceptionally(e);
            } finally {
                synchronized (this) {
                    runner = null;
                }
            }
        }

        void expire(Duration timeout) {
            if (!result.completeExceptionally(new TimeoutException("task exceeded " + timeout.toMillis() + " ms"))) {
                return;
            }
            timedOut.incrementAndGet();
            synchronized (this) {
                if (runner != null) runner.interrupt();
            }
        }
    }
}
