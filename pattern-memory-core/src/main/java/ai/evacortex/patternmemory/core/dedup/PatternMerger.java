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
import ai.evacortex.patternmemory.core.Evidence;
import ai.evacortex.patternmemory.core.HarmonicProfile;
import ai.evacortex.patternmemory.core.Pattern;
import ai.evacortex.patternmemory.core.PatternContent;
import ai.evacortex.patternmemory.core.PatternRelations;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds duplicates into a representative: occurrences summed, confidence averaged, strength and
 * complexity maximized, locations, evidence, tags and relations unioned.
 */
public final class PatternMerger {

    private PatternMerger() {}

    public static Pattern merge(Pattern representative, List<Pattern> absorbed) {
        List<Pattern> all = new ArrayList<>(absorbed.size() + 1);
        all.add(representative);
        all.addAll(absorbed);

        long occurrences = 0;
        double confidence = 0;
        double strength = 0;
        double complexity = 0;
        long createdAt = Long.MAX_VALUE;
        Map<String, CodeLocation> locations = new LinkedHashMap<>();
        Set<Evidence> evidence = new LinkedHashSet<>();
        Set<String> tags = new LinkedHashSet<>();
        PatternRelations relations = PatternRelations.NONE;
        Set<String> groupIds = new HashSet<>();

        for (Pattern p : all) {
            HarmonicProfile h = p.profile();
            occurrences += h.occurrences();
            confidence += h.confidence();
            strength = Math.max(strength, h.strength());
            complexity = Math.max(complexity, h.complexity());
            createdAt = Math.min(createdAt, p.createdAt());
            p.locations().forEach(l -> locations.putIfAbsent(l.spanKey(), l));
            evidence.addAll(p.evidence());
            tags.addAll(p.content().tags());
            relations = relations.union(p.relations());
            groupIds.add(p.id());
        }

        HarmonicProfile profile = new HarmonicProfile(representative.category(), strength,
                confidence / all.size(), complexity, (int) Math.min(Integer.MAX_VALUE, occurrences));
        PatternContent rc = representative.content();
        PatternContent content = new PatternContent(rc.title(), rc.description(), rc.type(),
                new ArrayList<>(tags), rc.data());

        return new Pattern(representative.id(), null, content, profile, new ArrayList<>(locations.values()),
                new ArrayList<>(evidence), relations.without(groupIds), createdAt);
    }
}
