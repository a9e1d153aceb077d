/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.dedup;

import ai.evacortex.patternmemory.core.CodeLocation;
import ai.evacortex.patternmemory.core.Pattern;
import ai.evacortex.patternmemory.core.tier.QualityScorer;
import ai.evacortex.patternmemory.core.tier.TierPolicy;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static ai.evacortex.patternmemory.core.PatternTestUtils.pattern;
import static ai.evacortex.patternmemory.core.PatternTestUtils.randomPatterns;
import static org.junit.jupiter.api.Assertions.*;

class DeduplicatorTest {

    private final QualityScorer scorer = new QualityScorer(TierPolicy.defaults());
    private final Deduplicator deduplicator =
            new Deduplicator(DeduplicationConfig.defaults(), p -> scorer.baseScore(p.profile()));

    private static Pattern nullCheck(String id, long createdAt, String title) {
        return Pattern.builder()
                .id(id)
                .content(title, "dereference without a prior null check", "null-safety")
                .profile("error", 0.8, 0.7, 3.0, 4)
                .location(CodeLocation.of("src/main/Service.java", 40, 52))
                .createdAt(createdAt)
                .build();
    }

    @Test
    void testIdenticalPatternsAreMerged() {
        Pattern first = nullCheck("b", 2_000L, "Missing null check");
        Pattern second = nullCheck("a", 1_000L, "Missing null check");

        Deduplicator.Outcome outcome = deduplicator.deduplicate(List.of(first, second));

        assertEquals(1, outcome.result().merged());
        assertEquals(1, outcome.result().candidatesFound());
        assertTrue(outcome.result().spaceSaved() > 0, "Absorbed bytes should be counted");
        assertEquals(1, outcome.survivors().size());

        Pattern survivor = outcome.survivors().get(0);
        assertEquals("a", survivor.id(), "Earliest pattern wins a quality tie");
        assertEquals(8, survivor.profile().occurrences(), "Occurrences are summed");
        assertEquals(1_000L, survivor.createdAt());
        assertEquals(1, survivor.locations().size(), "Shared locations are not duplicated");
        assertEquals(List.of("b"), outcome.removedIds());
    }

    @Test
    void testNearDuplicateTextIsMerged() {
        Pattern a = nullCheck("a", 1_000L, "Missing null check");
        Pattern b = nullCheck("b", 1_000L, "Missing nul check");

        assertTrue(deduplicator.similarity().similarity(a, b) >= 0.9);
        assertEquals(1, deduplicator.deduplicate(List.of(a, b)).survivors().size());
    }

    @Test
    void testGroupOfThreeCollapsesIntoOne() {
        List<Pattern> patterns = List.of(
                nullCheck("c", 3_000L, "Missing null check"),
                nullCheck("a", 1_000L, "Missing null check"),
                nullCheck("b", 2_000L, "Missing null check"));

        Deduplicator.Outcome outcome = deduplicator.deduplicate(patterns);

        assertEquals(1, outcome.survivors().size());
        assertEquals(2, outcome.result().merged());
        assertEquals(1, outcome.merges().size());
        Deduplicator.Merge merge = outcome.merges().get(0);
        assertEquals("a", merge.representativeId());
        assertEquals(List.of("b", "c"), merge.absorbedIds().stream().sorted().toList());
        assertEquals(12, merge.merged().profile().occurrences());
    }

    @Test
    void testRerunOnSurvivorsMergesNothing() {
        List<Pattern> patterns = new ArrayList<>(randomPatterns(21L, 200));
        patterns.add(nullCheck("dup-1", 1_000L, "Missing null check"));
        patterns.add(nullCheck("dup-2", 1_500L, "Missing null check"));

        Deduplicator.Outcome first = deduplicator.deduplicate(patterns);
        assertTrue(first.result().merged() >= 1);

        Deduplicator.Outcome second = deduplicator.deduplicate(first.survivors());
        assertEquals(0, second.result().merged(), "Deduplication must be idempotent");
        assertEquals(first.survivors().size(), second.survivors().size());
        assertTrue(second.merges().isEmpty());
    }

    @Test
    void testDistinctPatternsAreKept() {
        List<Pattern> patterns = randomPatterns(5L, 100);
        Deduplicator.Outcome outcome = deduplicator.deduplicate(patterns);

        assertEquals(0, outcome.result().merged());
        assertEquals(100, outcome.survivors().size());
        assertEquals(0L, outcome.result().spaceSaved());
    }

    @Test
    void testDifferentCategoriesAreNeverSimilar() {
        Pattern a = pattern("a", "auth", 0.8, 0.8, 2.0, 3);
        Pattern b = pattern("a2", "database", 0.8, 0.8, 2.0, 3);
        assertEquals(0.0, deduplicator.similarity().similarity(a, b));
    }

    @Test
    void testLocationOverlap() {
        Pattern a = nullCheck("a", 1L, "x");
        Pattern noLocation = Pattern.builder().id("n").content("x", "y", "z")
                .profile("general", 0.5, 0.5, 1.0, 1).build();
        Pattern noLocation2 = Pattern.builder().id("m").content("x", "y", "z")
                .profile("general", 0.5, 0.5, 1.0, 1).build();

        assertEquals(0.0, PatternSimilarity.locationOverlap(noLocation, noLocation2),
                "Missing locations are no evidence of overlap");
        assertEquals(0.0, PatternSimilarity.locationOverlap(a, noLocation));
        assertEquals(1.0, PatternSimilarity.locationOverlap(a, a));
    }

    @Test
    void testLocationlessPatternsWithSimilarTitlesAreKept() {
        Pattern login = Pattern.builder().id("login").content("Login handler validates JWT", "", "middleware")
                .profile("auth", 0.9, 0.8, 3.0, 10).createdAt(1_000L).build();
        Pattern logout = Pattern.builder().id("logout").content("Logout handler validates JWT", "", "middleware")
                .profile("auth", 0.9, 0.8, 3.0, 10).createdAt(1_000L).build();

        assertTrue(deduplicator.similarity().similarity(login, logout) < DeduplicationConfig.defaults().similarityThreshold());
        Deduplicator.Outcome outcome = deduplicator.deduplicate(List.of(login, logout));
        assertEquals(0, outcome.result().merged());
        assertEquals(2, outcome.survivors().size());
    }

    @Test
    void testLevenshtein() {
        assertEquals(3, PatternSimilarity.levenshtein("kitten", "sitting"));
        assertEquals(0, PatternSimilarity.levenshtein("", ""));
        assertEquals(4, PatternSimilarity.levenshtein("", "abcd"));
    }

    @Test
    void testFindDuplicateOf() {
        Pattern stored = nullCheck("stored", 1_000L, "Missing null check");
        Pattern unrelated = pattern("other", "auth", 0.9, 0.9, 2.0, 5);
        Pattern incoming = nullCheck("incoming", 5_000L, "Missing null check");

        Optional<Pattern> found = deduplicator.findDuplicateOf(incoming, List.of(unrelated, stored));
        assertTrue(found.isPresent());
        assertEquals("stored", found.get().id());

        assertTrue(deduplicator.findDuplicateOf(incoming, List.of(incoming, unrelated)).isEmpty(),
                "A pattern is never its own duplicate");
    }
}
