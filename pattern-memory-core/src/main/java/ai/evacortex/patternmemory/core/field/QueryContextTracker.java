/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.field;

import ai.evacortex.patternmemory.core.PatternCategory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Sliding window over the most recent queries.
 */
public class QueryContextTracker {

    public static final int DEFAULT_WINDOW = 20;

    private record Observation(QueryType type, PatternCategory category, long elapsedMillis, boolean hit) {}

    private final int window;
    private final Deque<Observation> observations = new ArrayDeque<>();

    public QueryContextTracker() {
        this(DEFAULT_WINDOW);
    }

    public QueryContextTracker(int window) {
        if (window < 1) throw new IllegalArgumentException("window must be >= 1");
        this.window = window;
    }

    /**
     * @param category signature category of the query, {@code null} for exploratory queries
     * @param hit      whether the query returned at least one result
     */
    public synchronized void record(QueryType type, PatternCategory category, long elapsedMillis, boolean hit) {
        if (observations.size() == window) observations.pollFirst();
        observations.addLast(new Observation(type, category, elapsedMillis, hit));
    }

    public synchronized QueryContext snapshot() {
        if (observations.isEmpty()) return QueryContext.EMPTY;
        List<QueryType> types = new ArrayList<>(observations.size());
        List<PatternCategory> categories = new ArrayList<>();
        long totalMillis = 0;
        int hits = 0;
        for (Observation o : observations) {
            types.add(o.type());
            if (o.category() != null) categories.add(o.category());
            totalMillis += o.elapsedMillis();
            if (o.hit()) hits++;
        }
        int n = observations.size();
        return new QueryContext(types, categories, (double) totalMillis / n, (double) hits / n, n);
    }

    public synchronized void reset() {
        observations.clear();
    }
}
