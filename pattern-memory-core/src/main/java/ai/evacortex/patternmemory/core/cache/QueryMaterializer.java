/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.cache;

import ai.evacortex.patternmemory.core.util.HashingUtil;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Caches results of expensive aggregate queries keyed by a canonical query signature.
 *
 * <p>A query is only materialized once it has been requested {@code minAccessCount} times or
 * once computing it took at least {@code minComputeMillis}. Views expire after a fixed TTL and
 * are dropped when a write touches one of their dependencies.</p>
 */
public class QueryMaterializer {

    private static final Logger log = LoggerFactory.getLogger(QueryMaterializer.class);

    /**
     * Kind of state a view was computed from.
     */
    public enum Dependency { PATTERNS, TIERS, ACCESS }

    private record View(Object value, Set<Dependency> dependencies, long computeMillis) {}

    private final int maxViews;
    private final long minAccessCount;
    private final long minComputeMillis;
    private final Cache<String, View> views;
    private final Map<String, AtomicLong> accessCounts = new ConcurrentHashMap<>();
    private final AtomicLong generation = new AtomicLong();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public QueryMaterializer(Duration ttl, int maxViews, long minAccessCount, long minComputeMillis) {
        this(ttl, maxViews, minAccessCount, minComputeMillis, Ticker.systemTicker());
    }

    public QueryMaterializer(Duration ttl, int maxViews, long minAccessCount, long minComputeMillis, Ticker ticker) {
        if (maxViews < 1) throw new IllegalArgumentException("maxViews must be >= 1");
        this.maxViews = maxViews;
        this.minAccessCount = minAccessCount;
        this.minComputeMillis = minComputeMillis;
        this.views = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    /**
     * Canonical signature: MD5 of the lower-cased name followed by the parameters sorted by key
     * and joined with {@code &}.
     */
    public static String signature(String name, Map<String, ?> params) {
        String joined = new TreeMap<>(params).entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("&"));
        String canonical = name.trim().toLowerCase(Locale.ROOT) + (joined.isEmpty() ? "" : "?" + joined);
        return HashingUtil.md5Hex(canonical);
    }

    public <T> T getOrCompute(AggregateQuery query, Supplier<T> compute) {
        return getOrCompute(query.name(), Map.of(), query.dependencies(), compute);
    }

    @SuppressWarnings("unchecked")
    public <T> T getOrCompute(String name, Map<String, ?> params, Set<Dependency> dependencies, Supplier<T> compute) {
        String sig = signature(name, params);
        long requests = accessCounts.computeIfAbsent(sig, k -> new AtomicLong()).incrementAndGet();

        View view = views.getIfPresent(sig);
        if (view != null) {
            hits.incrementAndGet();
            return (T) view.value();
        }
        misses.incrementAndGet();

        long gen = generation.get();
        long start = System.nanoTime();
        T value = compute.get();
        long elapsed = (System.nanoTime() - start) / 1_000_000;

        boolean worthKeeping = requests >= minAccessCount || elapsed >= minComputeMillis;
        if (worthKeeping && generation.get() == gen) {
            synchronized (this) {
                if (!views.asMap().containsKey(sig)) makeRoom();
                views.put(sig, new View(value, EnumSet.copyOf(dependencies), elapsed));
            }
            log.debug("Materialized {} after {} requests ({} ms)", name, requests, elapsed);
        }
        return value;
    }

    /**
     * Drops every view computed from the given kind of state.
     */
    public void invalidate(Dependency dependency) {
        generation.incrementAndGet();
        views.asMap().entrySet().removeIf(e -> e.getValue().dependencies().contains(dependency));
    }

    public void invalidateAll() {
        generation.incrementAndGet();
        views.invalidateAll();
    }

    public boolean isMaterialized(String name, Map<String, ?> params) {
        return views.asMap().containsKey(signature(name, params));
    }

    public MaterializerStats getStats() {
        views.cleanUp();
        Map<String, Long> counts = new HashMap<>();
        accessCounts.forEach((sig, n) -> counts.put(sig, n.get()));
        return new MaterializerStats((int) views.estimatedSize(), hits.get(), misses.get(), counts);
    }

    private void makeRoom() {
        views.cleanUp();
        while (views.estimatedSize() >= maxViews) {
            String victim = views.asMap().keySet().stream()
                    .min(Comparator.<String>comparingLong(s -> accessCounts.getOrDefault(s, new AtomicLong()).get())
                            .thenComparing(Comparator.naturalOrder()))
                    .orElse(null);
            if (victim == null) return;
            views.invalidate(victim);
            log.debug("Evicted least accessed view {}", victim);
        }
    }
}
