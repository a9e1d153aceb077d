/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.engine;

import ai.evacortex.patternmemory.core.Pattern;
import ai.evacortex.patternmemory.core.PatternCategory;
import ai.evacortex.patternmemory.core.cache.AggregateQuery;
import ai.evacortex.patternmemory.core.cache.WarmingStats;
import ai.evacortex.patternmemory.core.dedup.DeduplicationResult;
import ai.evacortex.patternmemory.core.exceptions.EngineClosedException;
import ai.evacortex.patternmemory.core.exceptions.InvalidIntentException;
import ai.evacortex.patternmemory.core.exceptions.InvalidPatternException;
import ai.evacortex.patternmemory.core.exceptions.TierExhaustedException;
import ai.evacortex.patternmemory.core.field.QueryIntent;
import ai.evacortex.patternmemory.core.tier.MigrationRecord;
import ai.evacortex.patternmemory.core.tier.MigrationReport;

import java.io.Closeable;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@code PatternMemory} is the contract of an embedded semantic memory for code-intelligence
 * patterns. Every stored {@link Pattern} is placed at a deterministic point of the cube
 * {@code [-1,1]^3} derived from its harmonic profile, indexed spatially and persisted in one of
 * the storage tiers chosen from its quality score.
 *
 * <p>Queries do not look up keys. A {@link QueryIntent} is turned into a probability field
 * around a semantic center; the patterns inside the field are scored by distance, shape and
 * falloff and returned best first. A tier that fails to answer in time is left out of the
 * result instead of failing the whole query.</p>
 *
 * <p>Implementations are thread-safe. Placement changes are atomic with respect to queries:
 * a pattern becomes visible in its tier and in the index at the same time. All operations
 * throw {@link EngineClosedException} after {@link #close()}.</p>
 *
 * @see QueryIntent
 * @see QueryResult
 */
public interface PatternMemory extends Closeable {

    /**
     * Stores a pattern, merging it into a stored near-duplicate when one lies within the
     * deduplication radius.
     *
     * @return how the pattern was placed
     * @throws InvalidPatternException if the pattern is malformed
     */
    StoreOutcome store(Pattern pattern);

    /**
     * Stores several patterns. A malformed pattern is reported as a failure and does not abort
     * the rest of the batch.
     */
    BatchStoreResult storeBatch(Collection<Pattern> patterns);

    /**
     * Runs a field query.
     *
     * @throws InvalidIntentException if the intent is malformed; raised before any I/O
     * @throws TierExhaustedException if every tier holding candidates failed
     */
    QueryResult query(QueryIntent intent);

    /**
     * @return the pattern, or empty if no pattern is stored under {@code id}
     */
    Optional<Pattern> get(String id);

    /**
     * The {@code k} patterns closest to a stored pattern, nearest first; empty if the id is
     * not indexed.
     */
    List<ScoredPattern> findSimilar(String id, int k);

    List<Pattern> queryByCategory(PatternCategory category, int limit);

    List<Pattern> queryByStrength(double minStrength, int limit);

    /**
     * Removes a pattern from its tier, the index and every cache.
     *
     * @return {@code false} if nothing was stored under {@code id}
     */
    boolean evict(String id);

    /**
     * Runs one migration cycle over all placements.
     */
    MigrationReport migrate();

    /**
     * Merges near-duplicates across all placements.
     */
    DeduplicationResult deduplicate();

    WarmingStats warmCache();

    /**
     * Retries queued tier writes.
     *
     * @return number of patterns that became visible
     */
    int retryPendingWrites();

    /**
     * Compares the index and placement directory with a full tier scan.
     *
     * @param repair rebuild the directory and index from the scan when they disagree
     */
    ConsistencyReport checkConsistency(boolean repair);

    /**
     * Answers a built-in aggregate query, from a materialized view when one is available.
     */
    Map<String, Number> aggregate(AggregateQuery query);

    EngineStats stats();

    List<MigrationRecord> migrationHistory();

    List<DeduplicationResult> deduplicationHistory();

    /**
     * Opens a session whose successive exploratory queries drift from the previous field.
     */
    QuerySession openSession();

    @Override
    void close();
}
