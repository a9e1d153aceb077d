/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.engine;

import ai.evacortex.patternmemory.core.exceptions.InvalidIntentException;
import ai.evacortex.patternmemory.core.field.ProbabilityField;
import ai.evacortex.patternmemory.core.field.QueryIntent;

import java.time.Clock;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Sequence of queries sharing one drifting field.
 *
 * <p>A query with a harmonic signature always gets a fresh field. A query without one reuses
 * the previous field of the session, morphed by the time elapsed since it was last used, so
 * exploration wanders from where it was instead of jumping to a new random center.</p>
 */
public class QuerySession {

    private final Function<QueryIntent, ProbabilityField> fieldFactory;
    private final BiFunction<ProbabilityField, Double, ProbabilityField> morph;
    private final BiFunction<QueryIntent, ProbabilityField, QueryResult> executor;
    private final Clock clock;

    private ProbabilityField lastField;
    private long lastUsedMillis;
    private int queries;

    QuerySession(Function<QueryIntent, ProbabilityField> fieldFactory,
                 BiFunction<ProbabilityField, Double, ProbabilityField> morph,
                 BiFunction<QueryIntent, ProbabilityField, QueryResult> executor,
                 Clock clock) {
        this.fieldFactory = fieldFactory;
        this.morph = morph;
        this.executor = executor;
        this.clock = clock;
    }

    public synchronized QueryResult query(QueryIntent intent) {
        if (intent == null) throw new InvalidIntentException("intent must not be null");
        long now = clock.millis();
        ProbabilityField field;
        if (lastField == null || intent.harmonicSignature() != null) {
            field = fieldFactory.apply(intent);
        } else {
            double deltaSeconds = Math.max(0, now - lastUsedMillis) / 1000.0;
            field = morph.apply(lastField, deltaSeconds);
            if (intent.radiusOverride() != null) field = field.withRadius(intent.radiusOverride());
        }
        QueryResult result = executor.apply(intent, field);
        lastField = field;
        lastUsedMillis = now;
        queries++;
        return result;
    }

    public synchronized Optional<ProbabilityField> lastField() {
        return Optional.ofNullable(lastField);
    }

    public synchronized int queryCount() {
        return queries;
    }
}
