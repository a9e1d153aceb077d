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
import ai.evacortex.patternmemory.core.util.HashingUtil;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Content similarity in [0,1] between two patterns of the same category.
 * Patterns of different categories always score 0.
 */
public class PatternSimilarity {

    private static final int MAX_TEXT = 512;

    private final DeduplicationConfig config;

    public PatternSimilarity(DeduplicationConfig config) {
        this.config = config;
    }

    public double similarity(Pattern a, Pattern b) {
        if (a.category() != b.category()) return 0.0;
        double weighted = config.textWeight() * textSimilarity(a, b)
                + config.structuralWeight() * (structuralSignature(a) == structuralSignature(b) ? 1.0 : 0.0)
                + config.locationWeight() * locationOverlap(a, b)
                + config.propertyWeight() * propertySimilarity(a, b);
        double total = config.textWeight() + config.structuralWeight() + config.locationWeight() + config.propertyWeight();
        return weighted / total;
    }

    public boolean isDuplicate(Pattern a, Pattern b) {
        return similarity(a, b) >= config.similarityThreshold();
    }

    /** xxhash64 of classification type, category and integral complexity. */
    public static long structuralSignature(Pattern p) {
        return HashingUtil.xxHash64(p.content().type().toLowerCase(Locale.ROOT) + "|" + p.category().name()
                + "|" + (long) Math.floor(p.profile().complexity()));
    }

    static double textSimilarity(Pattern a, Pattern b) {
        String ta = normalize(a.content().title() + " " + a.content().description());
        String tb = normalize(b.content().title() + " " + b.content().description());
        if (ta.isEmpty() && tb.isEmpty()) return 1.0;
        int max = Math.max(ta.length(), tb.length());
        return 1.0 - (double) levenshtein(ta, tb) / max;
    }

    /** Jaccard overlap of location spans; 0 when either pattern has no location. */
    static double locationOverlap(Pattern a, Pattern b) {
        Set<String> sa = spans(a);
        Set<String> sb = spans(b);
        if (sa.isEmpty() || sb.isEmpty()) return 0.0;
        Set<String> union = new HashSet<>(sa);
        union.addAll(sb);
        sa.retainAll(sb);
        return (double) sa.size() / union.size();
    }

    static double propertySimilarity(Pattern a, Pattern b) {
        double ds = Math.abs(a.profile().strength() - b.profile().strength());
        double dc = Math.abs(a.profile().confidence() - b.profile().confidence());
        double dx = Math.abs(Math.min(1.0, a.profile().complexity() / 10.0) - Math.min(1.0, b.profile().complexity() / 10.0));
        return 1.0 - (ds + dc + dx) / 3.0;
    }

    static int levenshtein(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] cur = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) prev[j] = j;
        for (int i = 1; i <= a.length(); i++) {
            cur[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                cur[j] = Math.min(Math.min(cur[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = cur;
            cur = tmp;
        }
        return prev[b.length()];
    }

    private static Set<String> spans(Pattern p) {
        Set<String> out = new HashSet<>();
        for (CodeLocation l : p.locations()) out.add(l.spanKey());
        return out;
    }

    private static String normalize(String s) {
        String n = s.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
        return n.length() > MAX_TEXT ? n.substring(0, MAX_TEXT) : n;
    }
}
