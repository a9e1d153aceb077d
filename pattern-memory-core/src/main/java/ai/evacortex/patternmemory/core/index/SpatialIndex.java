/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.index;

import ai.evacortex.patternmemory.core.geometry.Coordinate;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Spatial index over pattern coordinates in {@code [-1,1]^3}.
 *
 * <p>Implementations must be safe for concurrent use: any number of queries may run together,
 * structural mutations are exclusive, and a waiting writer is not starved by readers.</p>
 *
 * <p>Range queries are exact: the result of {@link #rangeQuery} equals the result of a linear
 * scan over the same entries. Queries against an empty index return empty results.</p>
 */
public interface SpatialIndex {

    /**
     * Builds the tree from a batch. Existing entries are kept and packed together with the batch.
     */
    void bulkLoad(Map<String, Coordinate> points);

    /**
     * Inserts or replaces an entry. Points outside the cube are clamped.
     */
    void insert(String id, Coordinate point);

    /**
     * @return {@code true} if the id was indexed
     */
    boolean remove(String id);

    /**
     * All ids whose point lies within Euclidean {@code radius} of {@code center}, sorted by id.
     */
    List<String> rangeQuery(Coordinate center, double radius);

    /**
     * The {@code k} entries closest to {@code point}, ascending by distance.
     */
    List<Neighbor> kNearest(Coordinate point, int k);

    /**
     * The {@code k} entries closest to the point of {@code id}, excluding {@code id} itself.
     * Returns an empty list when the id is not indexed.
     */
    List<Neighbor> kNearest(String id, int k);

    boolean contains(String id);

    Coordinate pointOf(String id);

    int size();

    Set<String> ids();

    void clear();

    IndexStats stats();

    /**
     * Forces queries to scan every entry instead of walking the tree.
     */
    void setLinearScan(boolean enabled);

    boolean isLinearScan();

    /**
     * @return invariant violations found in the structure, empty when healthy
     */
    List<String> verifyStructure();
}
