/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.dedup;

import ai.evacortex.patternmemory.core.Pattern;
import ai.evacortex.patternmemory.core.geometry.Coordinate;
import ai.evacortex.patternmemory.core.index.RTreeIndex;
import ai.evacortex.patternmemory.core.index.SpatialIndex;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.ToDoubleFunction;

/**
 * Detects and merges near-duplicate patterns.
 *
 * <p>Only patterns within {@link DeduplicationConfig#candidateRadius()} of each other are
 * compared. Confirmed pairs are grouped transitively and each group collapses into its
 * highest-quality member. Passes repeat until a pass finds nothing, so running the
 * deduplicator again on its own output merges nothing.</p>
 */
public class Deduplicator {

    private static final Logger log = LoggerFactory.getLogger(Deduplicator.class);

    /**
     * @param representativeId id kept by the merged pattern
     * @param absorbedIds      ids folded into it and no longer present
     * @param merged           the merged representative
     */
    public record Merge(String representativeId, List<String> absorbedIds, Pattern merged) {}

    public record Outcome(DeduplicationResult result, List<Pattern> survivors, List<Merge> merges) {

        public List<String> removedIds() {
            List<String> ids = new ArrayList<>();
            for (Merge m : merges) ids.addAll(m.absorbedIds());
            return ids;
        }
    }

    private final DeduplicationConfig config;
    private final PatternSimilarity similarity;
    private final ToDoubleFunction<Pattern> quality;
    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * @param quality score used to pick the representative of a duplicate group
     */
    public Deduplicator(DeduplicationConfig config, ToDoubleFunction<Pattern> quality) {
        this.config = config;
        this.similarity = new PatternSimilarity(config);
        this.quality = quality;
    }

    public DeduplicationConfig config() {
        return config;
    }

    public PatternSimilarity similarity() {
        return similarity;
    }

    public Outcome deduplicate(Collection<Pattern> patterns) {
        long start = System.nanoTime();
        Map<String, Pattern> current = new TreeMap<>();
        for (Pattern p : patterns) current.put(p.id(), p);

        int confirmedPairs = 0;
        int merged = 0;
        long spaceSaved = 0;
        Map<String, Merge> merges = new LinkedHashMap<>();

        while (true) {
            UnionFind groups = new UnionFind();
            confirmedPairs += collectDuplicatePairs(current, groups);
            List<List<String>> clusters = groups.clusters();
            if (clusters.isEmpty()) break;

            for (List<String> cluster : clusters) {
                List<Pattern> members = cluster.stream().map(current::get).toList();
                Pattern representative = chooseRepresentative(members);
                List<Pattern> absorbed = members.stream().filter(p -> p != representative).toList();
                Pattern mergedPattern = PatternMerger.merge(representative, absorbed);

                List<String> absorbedIds = new ArrayList<>();
                for (Pattern a : absorbed) {
                    current.remove(a.id());
                    absorbedIds.add(a.id());
                    spaceSaved += serializedSize(a);
                    Merge earlier = merges.remove(a.id());
                    if (earlier != null) absorbedIds.addAll(earlier.absorbedIds());
                }
                Merge previous = merges.get(representative.id());
                if (previous != null) absorbedIds.addAll(0, previous.absorbedIds());
                current.put(representative.id(), mergedPattern);
                merges.put(representative.id(), new Merge(representative.id(), List.copyOf(absorbedIds), mergedPattern));
                merged += absorbed.size();
            }
        }

        long elapsed = (System.nanoTime() - start) / 1_000_000;
        DeduplicationResult result = new DeduplicationResult(confirmedPairs, merged, spaceSaved, elapsed);
        if (merged > 0) {
            log.info("Deduplicated {} patterns into {} ({} pairs, {} bytes saved, {} ms)",
                    patterns.size(), current.size(), confirmedPairs, spaceSaved, elapsed);
        }
        return new Outcome(result, List.copyOf(current.values()), List.copyOf(merges.values()));
    }

    /**
     * Best duplicate of {@code incoming} among {@code neighbours}, by similarity.
     */
    public Optional<Pattern> findDuplicateOf(Pattern incoming, Collection<Pattern> neighbours) {
        Pattern best = null;
        double bestScore = -1;
        for (Pattern n : neighbours) {
            if (n.id().equals(incoming.id())) continue;
            if (n.coordinate().distanceTo(incoming.coordinate()) > config.candidateRadius()) continue;
            double s = similarity.similarity(incoming, n);
            if (s >= config.similarityThreshold() && s > bestScore) {
                best = n;
                bestScore = s;
            }
        }
        return Optional.ofNullable(best);
    }

    private int collectDuplicatePairs(Map<String, Pattern> current, UnionFind groups) {
        SpatialIndex index = new RTreeIndex();
        Map<String, Coordinate> points = new HashMap<>();
        current.forEach((id, p) -> points.put(id, p.coordinate()));
        index.bulkLoad(points);

        int pairs = 0;
        for (Pattern p : current.values()) {
            for (String otherId : index.rangeQuery(p.coordinate(), config.candidateRadius())) {
                if (otherId.compareTo(p.id()) <= 0) continue;
                if (similarity.isDuplicate(p, current.get(otherId))) {
                    groups.union(p.id(), otherId);
                    pairs++;
                }
            }
        }
        return pairs;
    }

    private Pattern chooseRepresentative(List<Pattern> members) {
        return members.stream()
                .max(Comparator.comparingDouble(quality)
                        .thenComparing(Pattern::createdAt, Comparator.reverseOrder())
                        .thenComparing(Pattern::id, Comparator.reverseOrder()))
                .orElseThrow();
    }

    long serializedSize(Pattern p) {
        try {
            return mapper.writeValueAsBytes(p).length;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to size pattern " + p.id(), e);
        }
    }

    private static final class UnionFind {
        private final Map<String, String> parent = new HashMap<>();

        void union(String a, String b) {
            String ra = find(a);
            String rb = find(b);
            if (ra.equals(rb)) return;
            if (ra.compareTo(rb) < 0) parent.put(rb, ra); else parent.put(ra, rb);
        }

        String find(String x) {
            parent.putIfAbsent(x, x);
            String root = x;
            while (!parent.get(root).equals(root)) root = parent.get(root);
            String cur = x;
            while (!cur.equals(root)) {
                String next = parent.get(cur);
                parent.put(cur, root);
                cur = next;
            }
            return root;
        }

        List<List<String>> clusters() {
            Map<String, List<String>> byRoot = new TreeMap<>();
            for (String id : new ArrayList<>(parent.keySet())) {
                byRoot.computeIfAbsent(find(id), k -> new ArrayList<>()).add(id);
            }
            List<List<String>> out = new ArrayList<>();
            for (List<String> members : byRoot.values()) {
                if (members.size() > 1) {
                    members.sort(Comparator.naturalOrder());
                    out.add(members);
                }
            }
            return out;
        }
    }
}
