/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.field;

import ai.evacortex.patternmemory.core.Pattern;
import ai.evacortex.patternmemory.core.PatternCategory;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Logic-gate filter applied to query candidates after field scoring.
 *
 * <pre>{@code
 * PatternFilter f = PatternFilter.and(
 *         PatternFilter.category(PatternCategory.AUTHENTICATION),
 *         PatternFilter.not(PatternFilter.tag("deprecated")),
 *         PatternFilter.boost(PatternFilter.tag("critical"), 1.5));
 * }</pre>
 *
 * A {@link Gate#BOOST} node never excludes a candidate; it multiplies the score of
 * candidates matching its operand.
 */
public final class PatternFilter {

    public enum Gate { MATCH, AND, OR, NOT, XOR, THRESHOLD, BOOST }

    public static final PatternFilter ACCEPT_ALL = where(p -> true);

    private final Gate gate;
    private final Predicate<Pattern> predicate;
    private final List<PatternFilter> operands;
    private final double value;

    private PatternFilter(Gate gate, Predicate<Pattern> predicate, List<PatternFilter> operands, double value) {
        this.gate = gate;
        this.predicate = predicate;
        this.operands = operands;
        this.value = value;
    }

    public static PatternFilter where(Predicate<Pattern> predicate) {
        return new PatternFilter(Gate.MATCH, Objects.requireNonNull(predicate, "predicate"), List.of(), 0);
    }

    public static PatternFilter category(PatternCategory category) {
        return where(p -> p.category() == category);
    }

    public static PatternFilter tag(String tag) {
        return where(p -> p.content().tags().contains(tag));
    }

    public static PatternFilter type(String type) {
        return where(p -> type.equals(p.content().type()));
    }

    public static PatternFilter and(PatternFilter... filters) {
        return new PatternFilter(Gate.AND, null, List.of(filters), 0);
    }

    public static PatternFilter or(PatternFilter... filters) {
        return new PatternFilter(Gate.OR, null, List.of(filters), 0);
    }

    public static PatternFilter not(PatternFilter filter) {
        return new PatternFilter(Gate.NOT, null, List.of(filter), 0);
    }

    /** Accepts patterns matching exactly one operand. */
    public static PatternFilter xor(PatternFilter... filters) {
        return new PatternFilter(Gate.XOR, null, List.of(filters), 0);
    }

    /** Accepts patterns with {@code strength >= minStrength}. */
    public static PatternFilter threshold(double minStrength) {
        return new PatternFilter(Gate.THRESHOLD, null, List.of(), minStrength);
    }

    public static PatternFilter boost(PatternFilter filter, double factor) {
        if (!(factor > 0)) throw new IllegalArgumentException("boost factor must be > 0: " + factor);
        return new PatternFilter(Gate.BOOST, null, List.of(filter), factor);
    }

    public Gate gate() {
        return gate;
    }

    public boolean accepts(Pattern p) {
        return switch (gate) {
            case MATCH -> predicate.test(p);
            case AND -> operands.stream().allMatch(f -> f.accepts(p));
            case OR -> operands.stream().anyMatch(f -> f.accepts(p));
            case NOT -> !operands.get(0).accepts(p);
            case XOR -> operands.stream().filter(f -> f.accepts(p)).count() == 1;
            case THRESHOLD -> p.profile().strength() >= value;
            case BOOST -> true;
        };
    }

    /** Product of the factors of every matching {@link Gate#BOOST} node in this tree. */
    public double boostFor(Pattern p) {
        double factor = 1.0;
        if (gate == Gate.BOOST && operands.get(0).accepts(p)) {
            factor *= value;
        }
        if (gate != Gate.NOT) {
            for (PatternFilter f : operands) factor *= f.boostFor(p);
        }
        return factor;
    }
}
