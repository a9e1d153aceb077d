/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.field;

import ai.evacortex.patternmemory.core.HarmonicProfile;
import ai.evacortex.patternmemory.core.exceptions.InvalidIntentException;

/**
 * What the caller is looking for. Construction validates every field and throws
 * {@link InvalidIntentException} on malformed input.
 *
 * @param queryType         precision, discovery or creative
 * @param harmonicSignature profile whose coordinate centers the field; {@code null} to explore
 * @param confidenceLevel   caller confidence in [0,1]
 * @param explorationDesire appetite for wider recall in [0,1]
 * @param urgencyMillis     latency budget; {@code null} when unconstrained
 * @param limit             maximum number of results, at least 1
 * @param radiusOverride    explicit field radius; {@code null} to derive it
 * @param filter            post-scoring logic-gate filter; {@code null} for none
 */
public record QueryIntent(QueryType queryType,
                          HarmonicProfile harmonicSignature,
                          double confidenceLevel,
                          double explorationDesire,
                          Long urgencyMillis,
                          int limit,
                          Double radiusOverride,
                          PatternFilter filter) {

    public static final int DEFAULT_LIMIT = 10;

    public QueryIntent {
        if (queryType == null) throw new InvalidIntentException("queryType must not be null");
        if (!(confidenceLevel >= 0 && confidenceLevel <= 1)) {
            throw new InvalidIntentException("confidenceLevel must be in [0,1]: " + confidenceLevel);
        }
        if (!(explorationDesire >= 0 && explorationDesire <= 1)) {
            throw new InvalidIntentException("explorationDesire must be in [0,1]: " + explorationDesire);
        }
        if (urgencyMillis != null && urgencyMillis < 0) {
            throw new InvalidIntentException("urgency must be >= 0: " + urgencyMillis);
        }
        if (limit < 1) throw new InvalidIntentException("limit must be >= 1: " + limit);
        if (radiusOverride != null && (!(radiusOverride > 0) || radiusOverride.isInfinite())) {
            throw new InvalidIntentException("radius must be finite and > 0: " + radiusOverride);
        }
        filter = filter == null ? PatternFilter.ACCEPT_ALL : filter;
    }

    public static Builder builder(QueryType type) {
        return new Builder(type);
    }

    public static final class Builder {
        private final QueryType type;
        private HarmonicProfile signature;
        private double confidence = 0.5;
        private double exploration = 0.0;
        private Long urgency;
        private int limit = DEFAULT_LIMIT;
        private Double radius;
        private PatternFilter filter;

        private Builder(QueryType type) {
            this.type = type;
        }

        public Builder signature(HarmonicProfile signature) {
            this.signature = signature;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder exploration(double exploration) {
            this.exploration = exploration;
            return this;
        }

        public Builder urgencyMillis(long urgency) {
            this.urgency = urgency;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder radius(double radius) {
            this.radius = radius;
            return this;
        }

        public Builder filter(PatternFilter filter) {
            this.filter = filter;
            return this;
        }

        public QueryIntent build() {
            return new QueryIntent(type, signature, confidence, exploration, urgency, limit, radius, filter);
        }
    }
}
