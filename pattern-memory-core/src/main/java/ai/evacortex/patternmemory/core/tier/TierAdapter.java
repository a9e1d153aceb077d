/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.tier;

import ai.evacortex.patternmemory.core.PatternRecord;
import ai.evacortex.patternmemory.core.StorageTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Boundary between the engine and one {@link TierStore}.
 *
 * <p>Each call runs on the I/O executor under a per-tier timeout. Exceptions thrown by the
 * backend and timeouts are turned into {@link TierOutcome}s here and go no further.
 * Writes are retried with exponential backoff.</p>
 */
public class TierAdapter {

    private static final Logger log = LoggerFactory.getLogger(TierAdapter.class);
    private static final Duration MAX_BACKOFF = Duration.ofSeconds(1);

    private final StorageTier tier;
    private final TierStore store;
    private final Executor executor;
    private final Duration timeout;
    private final int writeRetries;
    private final Duration retryBackoff;

    public TierAdapter(StorageTier tier, TierStore store, Executor executor,
                       Duration timeout, int writeRetries, Duration retryBackoff) {
        this.tier = Objects.requireNonNull(tier, "tier");
        this.store = Objects.requireNonNull(store, "store");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.timeout = timeout;
        this.writeRetries = Math.max(0, writeRetries);
        this.retryBackoff = retryBackoff;
    }

    public StorageTier tier() {
        return tier;
    }

    public CompletableFuture<TierOutcome<PatternRecord>> getAsync(String id) {
        return call(() -> store.get(id)
                .map(r -> TierOutcome.ok(tier, r))
                .orElseGet(() -> TierOutcome.notFound(tier)));
    }

    public TierOutcome<PatternRecord> get(String id) {
        return getAsync(id).join();
    }

    /**
     * Reads several records in one backend call. Ids the tier does not hold are absent from the map.
     */
    public CompletableFuture<TierOutcome<Map<String, PatternRecord>>> getAllAsync(Collection<String> ids) {
        List<String> wanted = List.copyOf(ids);
        return call(() -> {
            Map<String, PatternRecord> found = new LinkedHashMap<>();
            for (String id : wanted) {
                store.get(id).ifPresent(r -> found.put(id, r));
            }
            return TierOutcome.ok(tier, found);
        });
    }

    public CompletableFuture<TierOutcome<List<PatternRecord>>> scanAsync(Predicate<PatternRecord> filter) {
        return call(() -> TierOutcome.ok(tier, store.scan(filter)));
    }

    public TierOutcome<List<PatternRecord>> scan(Predicate<PatternRecord> filter) {
        return scanAsync(filter).join();
    }

    public TierOutcome<Integer> size() {
        return call(() -> TierOutcome.ok(tier, store.size())).join();
    }

    public TierOutcome<Boolean> delete(String id) {
        return call(() -> TierOutcome.ok(tier, store.delete(id))).join();
    }

    /**
     * Writes a record, retrying failed attempts up to {@code writeRetries} times with a doubling
     * pause between attempts.
     *
     * @return the outcome of the last attempt
     */
    public TierOutcome<PatternRecord> put(PatternRecord record) {
        long backoff = retryBackoff.toMillis();
        TierOutcome<PatternRecord> outcome = attemptPut(record);
        for (int attempt = 1; attempt <= writeRetries && outcome.isFailure(); attempt++) {
            log.debug("Write of {} to {} failed ({}), retry {}/{} in {} ms",
                    record.id(), tier, outcome.status(), attempt, writeRetries, backoff);
            try {
                Thread.sleep(backoff);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return TierOutcome.unavailable(tier, "interrupted while retrying");
            }
            backoff = Math.min(MAX_BACKOFF.toMillis(), backoff * 2);
            outcome = attemptPut(record);
        }
        if (outcome.isFailure()) {
            log.warn("Write of {} to {} failed after {} retries: {}", record.id(), tier, writeRetries, outcome.detail());
        }
        return outcome;
    }

    private TierOutcome<PatternRecord> attemptPut(PatternRecord record) {
        return call(() -> {
            store.put(record.id(), record);
            return TierOutcome.ok(tier, record);
        }).join();
    }

    private <T> CompletableFuture<TierOutcome<T>> call(Supplier<TierOutcome<T>> operation) {
        CompletableFuture<TierOutcome<T>> future;
        try {
            future = CompletableFuture.supplyAsync(operation, executor);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(TierOutcome.unavailable(tier, "executor rejected: " + e));
        }
        return future
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((value, error) -> {
                    if (error == null) return value;
                    Throwable cause = unwrap(error);
                    if (cause instanceof TimeoutException) {
                        log.warn("Tier {} timed out after {} ms", tier, timeout.toMillis());
                        return TierOutcome.timeout(tier);
                    }
                    log.warn("Tier {} failed: {}", tier, cause.toString());
                    return TierOutcome.unavailable(tier, cause.toString());
                });
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }
}
