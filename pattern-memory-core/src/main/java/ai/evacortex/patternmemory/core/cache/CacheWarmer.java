/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.cache;

import ai.evacortex.patternmemory.core.Pattern;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicLongArray;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Tracks per-pattern access frequency and keeps the most requested patterns resident.
 *
 * <p>Each {@link #warmCache} run picks the top-N patterns by weight, loads the ones that are
 * not yet resident into a bounded Caffeine cache and asks the owner to promote them to the
 * fastest tier. The weight is the total access count plus, per enabled {@link Strategy}, the
 * accesses seen in one hour of day: the current one for {@link Strategy#TIME_SLOT}, the next
 * one for {@link Strategy#PREDICTIVE}. Strategies can be combined.</p>
 */
public class CacheWarmer {

    private static final Logger log = LoggerFactory.getLogger(CacheWarmer.class);
    private static final long HOUR_MILLIS = Duration.ofHours(1).toMillis();

    public enum Strategy {
        FREQUENCY, TIME_SLOT, PREDICTIVE;

        public static Strategy of(String name) {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        }

        /**
         * Parses a comma separated list such as {@code "time_slot, predictive"}.
         */
        public static Set<Strategy> parseAll(String names) {
            EnumSet<Strategy> parsed = EnumSet.noneOf(Strategy.class);
            for (String name : names.split(",")) {
                if (!name.isBlank()) parsed.add(of(name));
            }
            if (parsed.isEmpty()) throw new IllegalArgumentException("No warm strategy in '" + names + "'");
            return parsed;
        }

        public static String format(Set<Strategy> strategies) {
            return strategies.stream().map(Enum::name).collect(Collectors.joining(","));
        }
    }

    /**
     * Callback into the owner of the placements.
     */
    @FunctionalInterface
    public interface Promoter {
        /**
         * @return {@code true} if the pattern changed tier
         */
        boolean promote(String id);
    }

    private final int topN;
    private final Set<Strategy> strategies;
    private final Cache<String, Pattern> hot;
    private final Map<String, LongAdder> frequency = new ConcurrentHashMap<>();
    private final Map<String, AtomicLongArray> hourSlots = new ConcurrentHashMap<>();

    private final AtomicLong patternsWarmed = new AtomicLong();
    private final AtomicLong cycles = new AtomicLong();
    private final AtomicLong cumulativeMillis = new AtomicLong();

    public CacheWarmer(int topN, int hotCacheSize, Duration expireAfterAccess, Strategy first, Strategy... rest) {
        this(topN, hotCacheSize, expireAfterAccess, EnumSet.of(first, rest));
    }

    public CacheWarmer(int topN, int hotCacheSize, Duration expireAfterAccess, Set<Strategy> strategies) {
        if (topN < 1) throw new IllegalArgumentException("topN must be >= 1");
        if (hotCacheSize < 1) throw new IllegalArgumentException("hotCacheSize must be >= 1");
        if (strategies.isEmpty()) throw new IllegalArgumentException("at least one strategy is required");
        this.topN = topN;
        this.strategies = Collections.unmodifiableSet(EnumSet.copyOf(strategies));
        this.hot = Caffeine.newBuilder()
                .maximumSize(hotCacheSize)
                .expireAfterAccess(expireAfterAccess)
                .executor(Runnable::run)
                .recordStats()
                .build();
    }

    public Set<Strategy> strategies() {
        return strategies;
    }

    public void recordAccess(String id, long now) {
        frequency.computeIfAbsent(id, k -> new LongAdder()).increment();
        hourSlots.computeIfAbsent(id, k -> new AtomicLongArray(24)).incrementAndGet(hourOf(now));
    }

    public long frequencyOf(String id) {
        LongAdder adder = frequency.get(id);
        return adder == null ? 0 : adder.sum();
    }

    /**
     * Drops all state for a pattern that no longer exists under this id.
     */
    public void forget(String id) {
        frequency.remove(id);
        hourSlots.remove(id);
        hot.invalidate(id);
    }

    public Optional<Pattern> getIfHot(String id) {
        return Optional.ofNullable(hot.getIfPresent(id));
    }

    /**
     * Replaces the resident copy of a pattern, if there is one.
     */
    public void refresh(Pattern pattern) {
        hot.asMap().computeIfPresent(pattern.id(), (k, old) -> pattern);
    }

    public void invalidateAll() {
        hot.invalidateAll();
    }

    /**
     * Ids that would be warmed now, hottest first.
     */
    public List<String> candidates(long now) {
        int hour = hourOf(now);
        List<Map.Entry<String, Long>> scored = new ArrayList<>();
        frequency.forEach((id, adder) -> {
            long score = adder.sum();
            AtomicLongArray slots = hourSlots.get(id);
            if (slots != null) {
                if (strategies.contains(Strategy.TIME_SLOT)) score += slots.get(hour);
                if (strategies.contains(Strategy.PREDICTIVE)) score += slots.get((hour + 1) % 24);
            }
            if (score > 0) scored.add(Map.entry(id, score));
        });
        scored.sort(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()));
        return scored.stream().limit(topN).map(Map.Entry::getKey).toList();
    }

    /**
     * Runs one warming cycle.
     *
     * @param loader   resolves a pattern by id, empty if it no longer exists
     * @param promoter asked to move each hot pattern to the fastest tier
     */
    public synchronized WarmingStats warmCache(long now, Function<String, Optional<Pattern>> loader, Promoter promoter) {
        long start = System.nanoTime();
        int warmed = 0;
        for (String id : candidates(now)) {
            boolean[] loaded = new boolean[1];
            // loading inside the cache's compute keeps a concurrent refresh from being overwritten
            Pattern resident = hot.get(id, k -> {
                loaded[0] = true;
                return loader.apply(k).orElse(null);
            });
            if (resident == null) {
                forget(id);
                continue;
            }
            boolean changed = loaded[0];
            if (promoter.promote(id)) changed = true;
            if (changed) warmed++;
        }
        long elapsed = (System.nanoTime() - start) / 1_000_000;
        patternsWarmed.addAndGet(warmed);
        cumulativeMillis.addAndGet(elapsed);
        long cycle = cycles.incrementAndGet();
        log.debug("Warming cycle {} warmed {} patterns in {} ms", cycle, warmed, elapsed);
        return getStats();
    }

    public WarmingStats getStats() {
        hot.cleanUp();
        return new WarmingStats(patternsWarmed.get(), cycles.get(), cumulativeMillis.get(),
                hot.estimatedSize(), hot.stats().hitRate());
    }

    private static int hourOf(long epochMillis) {
        return (int) Math.floorMod(epochMillis / HOUR_MILLIS, 24L);
    }
}
