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
import ai.evacortex.patternmemory.core.PatternContent;
import ai.evacortex.patternmemory.core.PatternTestUtils;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PatternFilterTest {

    private final Pattern strongAuth = PatternTestUtils.pattern("a", "auth", 0.9, 0.8, 3, 10);
    private final Pattern weakAuth = PatternTestUtils.pattern("b", "auth", 0.2, 0.8, 3, 10);
    private final Pattern strongError = PatternTestUtils.pattern("c", "error", 0.9, 0.8, 3, 10);
    private final Pattern tagged = Pattern.builder()
            .id("d")
            .content(new PatternContent("retry", "retry loop", "loop", List.of("critical"), null))
            .profile("recovery", 0.7, 0.7, 2, 3)
            .build();

    @Test
    void testAndOrNotXor() {
        PatternFilter auth = PatternFilter.category(PatternCategory.AUTHENTICATION);
        PatternFilter strong = PatternFilter.threshold(0.5);

        assertTrue(PatternFilter.and(auth, strong).accepts(strongAuth));
        assertFalse(PatternFilter.and(auth, strong).accepts(weakAuth));
        assertTrue(PatternFilter.or(auth, strong).accepts(strongError));
        assertFalse(PatternFilter.not(auth).accepts(strongAuth));
        assertTrue(PatternFilter.xor(auth, strong).accepts(weakAuth), "Exactly one operand holds");
        assertFalse(PatternFilter.xor(auth, strong).accepts(strongAuth), "Both operands hold");
    }

    @Test
    void testThresholdIsInclusive() {
        assertTrue(PatternFilter.threshold(0.9).accepts(strongAuth));
        assertFalse(PatternFilter.threshold(0.91).accepts(strongAuth));
    }

    @Test
    void testBoostNeverExcludesAndMultipliesMatches() {
        PatternFilter filter = PatternFilter.and(
                PatternFilter.boost(PatternFilter.tag("critical"), 1.5),
                PatternFilter.boost(PatternFilter.type("loop"), 2.0));

        assertTrue(filter.accepts(strongAuth));
        assertEquals(1.0, filter.boostFor(strongAuth), 1e-12);
        assertEquals(3.0, filter.boostFor(tagged), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> PatternFilter.boost(PatternFilter.ACCEPT_ALL, 0));
    }

    @Test
    void testBoostUnderNotIsIgnored() {
        PatternFilter filter = PatternFilter.not(PatternFilter.boost(PatternFilter.tag("critical"), 5));
        assertEquals(1.0, filter.boostFor(tagged), 1e-12);
    }
}
