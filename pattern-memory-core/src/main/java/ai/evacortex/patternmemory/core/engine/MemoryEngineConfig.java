/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.engine;

import ai.evacortex.patternmemory.core.cache.CacheWarmer;
import ai.evacortex.patternmemory.core.dedup.DeduplicationConfig;
import ai.evacortex.patternmemory.core.field.FieldTuning;
import ai.evacortex.patternmemory.core.index.RTreeIndex;
import ai.evacortex.patternmemory.core.tier.TierPolicy;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Engine configuration. Interval settings of zero disable the corresponding background task.
 */
public record MemoryEngineConfig(int indexNodeCapacity,
                                 DeduplicationConfig dedup,
                                 boolean dedupOnStore,
                                 TierPolicy tierPolicy,
                                 FieldTuning fieldTuning,
                                 long fieldSeed,
                                 int ioThreads,
                                 Duration tierTimeout,
                                 int writeRetries,
                                 Duration retryBackoff,
                                 int migrationBatchSize,
                                 Duration migrationInterval,
                                 Duration rescoreInterval,
                                 int warmTopN,
                                 Duration warmInterval,
                                 int hotCacheSize,
                                 Duration hotCacheExpiry,
                                 Set<CacheWarmer.Strategy> warmStrategies,
                                 Duration materializeTtl,
                                 int materializeMaxViews,
                                 long materializeMinAccess,
                                 long materializeMinComputeMillis,
                                 int auditWindow,
                                 int contextWindow,
                                 Duration consistencyInterval,
                                 Duration retryInterval) {

    private static final String PREFIX = "patternmemory.";

    public MemoryEngineConfig {
        if (ioThreads < 1) throw new IllegalArgumentException("ioThreads must be >= 1");
        if (writeRetries < 0) throw new IllegalArgumentException("writeRetries must be >= 0");
        if (migrationBatchSize < 1) throw new IllegalArgumentException("migrationBatchSize must be >= 1");
        if (auditWindow < 1) throw new IllegalArgumentException("auditWindow must be >= 1");
        if (indexNodeCapacity < RTreeIndex.MIN_CAPACITY || indexNodeCapacity > RTreeIndex.MAX_CAPACITY) {
            throw new IllegalArgumentException("indexNodeCapacity must be in [" + RTreeIndex.MIN_CAPACITY
                    + ", " + RTreeIndex.MAX_CAPACITY + "]");
        }
        if (warmStrategies == null || warmStrategies.isEmpty()) {
            throw new IllegalArgumentException("at least one warm strategy is required");
        }
        warmStrategies = Collections.unmodifiableSet(EnumSet.copyOf(warmStrategies));
        if (tierTimeout.isZero() || tierTimeout.isNegative()) {
            throw new IllegalArgumentException("tierTimeout must be > 0");
        }
    }

    public static MemoryEngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Defaults overridden by {@code patternmemory.*} system properties.
     */
    public static MemoryEngineConfig fromSystemProperties() {
        MemoryEngineConfig d = defaults();
        DeduplicationConfig dedup = d.dedup()
                .withRadius(doubleProp("dedup.radius", d.dedup().candidateRadius()))
                .withThreshold(doubleProp("dedup.threshold", d.dedup().similarityThreshold()));
        return builder()
                .indexNodeCapacity(intProp("index.nodeCapacity", d.indexNodeCapacity()))
                .dedup(dedup)
                .tierTimeout(millisProp("tier.timeoutMillis", d.tierTimeout()))
                .writeRetries(intProp("tier.writeRetries", d.writeRetries()))
                .retryBackoff(millisProp("tier.retryBackoffMillis", d.retryBackoff()))
                .migrationBatchSize(intProp("migration.batchSize", d.migrationBatchSize()))
                .migrationInterval(millisProp("migration.intervalMillis", d.migrationInterval()))
                .rescoreInterval(millisProp("migration.rescoreMillis", d.rescoreInterval()))
                .warmTopN(intProp("warm.topN", d.warmTopN()))
                .warmInterval(millisProp("warm.intervalMillis", d.warmInterval()))
                .hotCacheSize(intProp("warm.hotCacheSize", d.hotCacheSize()))
                .warmStrategies(CacheWarmer.Strategy.parseAll(
                        System.getProperty(PREFIX + "warm.strategy", CacheWarmer.Strategy.format(d.warmStrategies()))))
                .materializeTtl(millisProp("materialize.ttlMillis", d.materializeTtl()))
                .materializeMaxViews(intProp("materialize.maxViews", d.materializeMaxViews()))
                .materializeMinAccess(intProp("materialize.minAccess", (int) d.materializeMinAccess()))
                .materializeMinComputeMillis(intProp("materialize.minComputeMillis", (int) d.materializeMinComputeMillis()))
                .auditWindow(intProp("audit.window", d.auditWindow()))
                .consistencyInterval(millisProp("consistency.intervalMillis", d.consistencyInterval()))
                .retryInterval(millisProp("retry.intervalMillis", d.retryInterval()))
                .fieldSeed(longProp("field.seed", d.fieldSeed()))
                .build();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    private static int intProp(String key, int def) {
        String raw = System.getProperty(PREFIX + key);
        if (raw == null) return def;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + key + " is not an integer: '" + raw + "'", e);
        }
    }

    private static long longProp(String key, long def) {
        String raw = System.getProperty(PREFIX + key);
        if (raw == null) return def;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + key + " is not an integer: '" + raw + "'", e);
        }
    }

    private static double doubleProp(String key, double def) {
        String raw = System.getProperty(PREFIX + key);
        if (raw == null) return def;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + key + " is not a number: '" + raw + "'", e);
        }
    }

    private static Duration millisProp(String key, Duration def) {
        String raw = System.getProperty(PREFIX + key);
        if (raw == null) return def;
        try {
            return Duration.ofMillis(Long.parseLong(raw.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + key + " is not a millisecond count: '" + raw + "'", e);
        }
    }

    public static final class Builder {
        private int indexNodeCapacity = RTreeIndex.DEFAULT_MAX_ENTRIES;
        private DeduplicationConfig dedup = DeduplicationConfig.defaults();
        private boolean dedupOnStore = true;
        private TierPolicy tierPolicy = TierPolicy.defaults();
        private FieldTuning fieldTuning = FieldTuning.defaults();
        private long fieldSeed = 42L;
        private int ioThreads = 4;
        private Duration tierTimeout = Duration.ofSeconds(2);
        private int writeRetries = 3;
        private Duration retryBackoff = Duration.ofMillis(25);
        private int migrationBatchSize = 256;
        private Duration migrationInterval = Duration.ZERO;
        private Duration rescoreInterval = Duration.ofHours(1);
        private int warmTopN = 50;
        private Duration warmInterval = Duration.ZERO;
        private int hotCacheSize = 1_000;
        private Duration hotCacheExpiry = Duration.ofMinutes(30);
        private Set<CacheWarmer.Strategy> warmStrategies = EnumSet.of(CacheWarmer.Strategy.FREQUENCY);
        private Duration materializeTtl = Duration.ofMinutes(5);
        private int materializeMaxViews = 32;
        private long materializeMinAccess = 3;
        private long materializeMinComputeMillis = 50;
        private int auditWindow = 1_000;
        private int contextWindow = 20;
        private Duration consistencyInterval = Duration.ZERO;
        private Duration retryInterval = Duration.ZERO;

        private Builder() {}

        private Builder(MemoryEngineConfig c) {
            indexNodeCapacity = c.indexNodeCapacity;
            dedup = c.dedup;
            dedupOnStore = c.dedupOnStore;
            tierPolicy = c.tierPolicy;
            fieldTuning = c.fieldTuning;
            fieldSeed = c.fieldSeed;
            ioThreads = c.ioThreads;
            tierTimeout = c.tierTimeout;
            writeRetries = c.writeRetries;
            retryBackoff = c.retryBackoff;
            migrationBatchSize = c.migrationBatchSize;
            migrationInterval = c.migrationInterval;
            rescoreInterval = c.rescoreInterval;
            warmTopN = c.warmTopN;
            warmInterval = c.warmInterval;
            hotCacheSize = c.hotCacheSize;
            hotCacheExpiry = c.hotCacheExpiry;
            warmStrategies = c.warmStrategies;
            materializeTtl = c.materializeTtl;
            materializeMaxViews = c.materializeMaxViews;
            materializeMinAccess = c.materializeMinAccess;
            materializeMinComputeMillis = c.materializeMinComputeMillis;
            auditWindow = c.auditWindow;
            contextWindow = c.contextWindow;
            consistencyInterval = c.consistencyInterval;
            retryInterval = c.retryInterval;
        }

        public Builder indexNodeCapacity(int v) { this.indexNodeCapacity = v; return this; }
        public Builder dedup(DeduplicationConfig v) { this.dedup = v; return this; }
        public Builder dedupOnStore(boolean v) { this.dedupOnStore = v; return this; }
        public Builder tierPolicy(TierPolicy v) { this.tierPolicy = v; return this; }
        public Builder fieldTuning(FieldTuning v) { this.fieldTuning = v; return this; }
        public Builder fieldSeed(long v) { this.fieldSeed = v; return this; }
        public Builder ioThreads(int v) { this.ioThreads = v; return this; }
        public Builder tierTimeout(Duration v) { this.tierTimeout = v; return this; }
        public Builder writeRetries(int v) { this.writeRetries = v; return this; }
        public Builder retryBackoff(Duration v) { this.retryBackoff = v; return this; }
        public Builder migrationBatchSize(int v) { this.migrationBatchSize = v; return this; }
        public Builder migrationInterval(Duration v) { this.migrationInterval = v; return this; }
        public Builder rescoreInterval(Duration v) { this.rescoreInterval = v; return this; }
        public Builder warmTopN(int v) { this.warmTopN = v; return this; }
        public Builder warmInterval(Duration v) { this.warmInterval = v; return this; }
        public Builder hotCacheSize(int v) { this.hotCacheSize = v; return this; }
        public Builder hotCacheExpiry(Duration v) { this.hotCacheExpiry = v; return this; }
        public Builder warmStrategies(Set<CacheWarmer.Strategy> v) { this.warmStrategies = v; return this; }
        public Builder warmStrategies(CacheWarmer.Strategy first, CacheWarmer.Strategy... rest) {
            this.warmStrategies = EnumSet.of(first, rest);
            return this;
        }
        public Builder materializeTtl(Duration v) { this.materializeTtl = v; return this; }
        public Builder materializeMaxViews(int v) { this.materializeMaxViews = v; return this; }
        public Builder materializeMinAccess(long v) { this.materializeMinAccess = v; return this; }
        public Builder materializeMinComputeMillis(long v) { this.materializeMinComputeMillis = v; return this; }
        public Builder auditWindow(int v) { this.auditWindow = v; return this; }
        public Builder contextWindow(int v) { this.contextWindow = v; return this; }
        public Builder consistencyInterval(Duration v) { this.consistencyInterval = v; return this; }
        public Builder retryInterval(Duration v) { this.retryInterval = v; return this; }

        public MemoryEngineConfig build() {
            return new MemoryEngineConfig(indexNodeCapacity, dedup, dedupOnStore, tierPolicy, fieldTuning, fieldSeed,
                    ioThreads, tierTimeout, writeRetries, retryBackoff, migrationBatchSize, migrationInterval,
                    rescoreInterval, warmTopN, warmInterval, hotCacheSize, hotCacheExpiry, warmStrategies,
                    materializeTtl, materializeMaxViews, materializeMinAccess, materializeMinComputeMillis,
                    auditWindow, contextWindow, consistencyInterval, retryInterval);
        }
    }
}
