/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core;

import ai.evacortex.patternmemory.core.exceptions.InvalidPatternException;
import ai.evacortex.patternmemory.core.geometry.Coordinate;
import ai.evacortex.patternmemory.core.geometry.CoordinateHasher;
import ai.evacortex.patternmemory.core.util.HashingUtil;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A discovered code-intelligence pattern, the unit of memory.
 *
 * <p>The coordinate is derived from the {@link HarmonicProfile} by the canonical constructor;
 * whatever value is passed for it is discarded. Two patterns with equal profiles therefore
 * always share a coordinate.</p>
 *
 * <p>When no id is supplied, the id is the MD5 content hash of category, title, description
 * and code locations.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Pattern(String id,
                      Coordinate coordinate,
                      PatternContent content,
                      HarmonicProfile profile,
                      List<CodeLocation> locations,
                      List<Evidence> evidence,
                      PatternRelations relations,
                      long createdAt) {

    public Pattern {
        if (profile == null) throw new InvalidPatternException("profile must not be null");
        content = content == null ? PatternContent.of("", "", "") : content;
        locations = locations == null ? List.of() : List.copyOf(locations);
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        relations = relations == null ? PatternRelations.NONE : relations;
        coordinate = CoordinateHasher.generateSemanticCoordinates(profile);
        if (id == null || id.isBlank()) {
            id = contentId(profile.category(), content, locations);
        }
    }

    public static String contentId(PatternCategory category, PatternContent content, List<CodeLocation> locations) {
        StringBuilder sb = new StringBuilder()
                .append(category.name()).append('|')
                .append(content.title()).append('|')
                .append(content.description());
        locations.stream().map(CodeLocation::spanKey).sorted().forEach(k -> sb.append('|').append(k));
        return HashingUtil.md5Hex(sb.toString());
    }

    public PatternCategory category() {
        return profile.category();
    }

    public Pattern withProfile(HarmonicProfile newProfile) {
        return new Pattern(id, null, content, newProfile, locations, evidence, relations, createdAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private PatternContent content;
        private HarmonicProfile profile;
        private final List<CodeLocation> locations = new ArrayList<>();
        private final List<Evidence> evidence = new ArrayList<>();
        private PatternRelations relations = PatternRelations.NONE;
        private long createdAt = System.currentTimeMillis();

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder content(PatternContent content) {
            this.content = content;
            return this;
        }

        public Builder content(String title, String description, String type) {
            this.content = PatternContent.of(title, description, type);
            return this;
        }

        public Builder profile(HarmonicProfile profile) {
            this.profile = profile;
            return this;
        }

        public Builder profile(String category, double strength, double confidence, double complexity, int occurrences) {
            this.profile = HarmonicProfile.of(category, strength, confidence, complexity, occurrences);
            return this;
        }

        public Builder location(CodeLocation location) {
            this.locations.add(Objects.requireNonNull(location, "location"));
            return this;
        }

        public Builder evidence(Evidence e) {
            this.evidence.add(Objects.requireNonNull(e, "evidence"));
            return this;
        }

        public Builder relations(PatternRelations relations) {
            this.relations = relations;
            return this;
        }

        public Builder createdAt(long createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Pattern build() {
            return new Pattern(id, null, content, profile, locations, evidence, relations, createdAt);
        }
    }
}
