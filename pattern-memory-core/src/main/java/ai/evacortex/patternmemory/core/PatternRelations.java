/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Advisory links to other pattern ids. Targets are not required to exist.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PatternRelations(List<String> related, List<String> causes, List<String> requiredBy) {

    public static final PatternRelations NONE = new PatternRelations(List.of(), List.of(), List.of());

    public PatternRelations {
        related = related == null ? List.of() : List.copyOf(related);
        causes = causes == null ? List.of() : List.copyOf(causes);
        requiredBy = requiredBy == null ? List.of() : List.copyOf(requiredBy);
    }

    public PatternRelations union(PatternRelations other) {
        return new PatternRelations(merge(related, other.related), merge(causes, other.causes),
                merge(requiredBy, other.requiredBy));
    }

    public PatternRelations without(Set<String> ids) {
        return new PatternRelations(
                related.stream().filter(id -> !ids.contains(id)).toList(),
                causes.stream().filter(id -> !ids.contains(id)).toList(),
                requiredBy.stream().filter(id -> !ids.contains(id)).toList());
    }

    private static List<String> merge(List<String> a, List<String> b) {
        Set<String> out = new LinkedHashSet<>(a);
        out.addAll(b);
        return List.copyOf(out);
    }
}
