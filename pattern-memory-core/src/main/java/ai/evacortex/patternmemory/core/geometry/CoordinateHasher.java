/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.geometry;

import ai.evacortex.patternmemory.core.HarmonicProfile;
import ai.evacortex.patternmemory.core.PatternCategory;
import ai.evacortex.patternmemory.core.util.HashingUtil;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Deterministic mapping from a semantic profile to a point in {@code [-1,1]^3}.
 *
 * <p>A coordinate is the sum of three parts, clamped to the cube:</p>
 * <ol>
 *     <li>the category anchor: X from the category neighborhood (security near -0.7,
 *     error handling near +0.85), Y and Z from the digest of the category name;</li>
 *     <li>a bounded profile offset from strength, complexity and occurrences;</li>
 *     <li>a small jitter from the digest of the canonical composition string.</li>
 * </ol>
 *
 * <p>Patterns of the same category land within about 0.18 of each other. Identical profiles
 * give identical points. All methods are pure.</p>
 */
public final class CoordinateHasher {

    static final double ANCHOR_SPREAD_X = 0.8;
    static final double ANCHOR_SPREAD_YZ = 0.6;
    static final double STRENGTH_SPAN = 0.08;
    static final double COMPLEXITY_SPAN = 0.06;
    static final double OCCURRENCE_SPAN = 0.04;
    static final double JITTER = 0.02;
    static final double COMPLEXITY_CAP = 10.0;

    private static final double MAX_SEGMENT = 4294967295.0;
    private static final int SEGMENT_BYTES = 4;

    private static final Map<PatternCategory, Coordinate> ANCHORS = buildAnchors();

    private CoordinateHasher() {}

    /** SHA-256 of {@code UPPER(category):composition}. */
    public static byte[] hash(String category, String composition) {
        String key = category.toUpperCase(Locale.ROOT) + ":" + composition;
        return HashingUtil.sha256(key);
    }

    /**
     * Splits the first 12 bytes of the digest into three unsigned 32-bit segments and
     * remaps each from {@code [0, 2^32-1]} to {@code [-1,1]}.
     */
    public static Coordinate toCoordinates(byte[] digest) {
        if (digest == null || digest.length < 3 * SEGMENT_BYTES) {
            throw new IllegalArgumentException("Digest must have at least " + 3 * SEGMENT_BYTES + " bytes");
        }
        ByteBuffer buf = ByteBuffer.wrap(digest);
        double[] axes = new double[3];
        for (int i = 0; i < 3; i++) {
            long segment = Integer.toUnsignedLong(buf.getInt(i * SEGMENT_BYTES));
            axes[i] = (segment / MAX_SEGMENT) * 2.0 - 1.0;
        }
        return new Coordinate(axes[0], axes[1], axes[2]);
    }

    public static Coordinate hashCoordinates(String category, String composition) {
        return toCoordinates(hash(category, composition));
    }

    public static String composition(PatternCategory category, double strength, double complexity, int occurrences) {
        return String.format(Locale.ROOT, "%s|s=%.4f|c=%.4f|o=%d", category.name(), strength, complexity, occurrences);
    }

    public static Coordinate generateSemanticCoordinates(HarmonicProfile profile) {
        return generateSemanticCoordinates(profile.category(), profile.strength(), profile.complexity(),
                profile.occurrences());
    }

    public static Coordinate generateSemanticCoordinates(PatternCategory category, double strength,
                                                         double complexity, int occurrences) {
        Coordinate anchor = anchor(category);
        Coordinate jitter = hashCoordinates(category.name(), composition(category, strength, complexity, occurrences));

        double dx = (clamp01(strength) - 0.5) * STRENGTH_SPAN;
        double dy = (Math.min(Math.max(complexity, 0.0), COMPLEXITY_CAP) / COMPLEXITY_CAP - 0.5) * COMPLEXITY_SPAN;
        double dz = (Math.tanh(Math.log10(Math.max(1, occurrences)) / 2.0) - 0.5) * OCCURRENCE_SPAN;

        return new Coordinate(
                anchor.x() + dx + jitter.x() * JITTER,
                anchor.y() + dy + jitter.y() * JITTER,
                anchor.z() + dz + jitter.z() * JITTER).clamp();
    }

    public static Coordinate anchor(PatternCategory category) {
        return ANCHORS.get(category);
    }

    public static double distance(Coordinate a, Coordinate b) {
        return a.distanceTo(b);
    }

    public static BoundingBox boundingBox(Coordinate center, double radius) {
        if (radius < 0) throw new IllegalArgumentException("radius must be >= 0: " + radius);
        return new BoundingBox(
                Coordinate.clamp(center.x() - radius), Coordinate.clamp(center.y() - radius),
                Coordinate.clamp(center.z() - radius), Coordinate.clamp(center.x() + radius),
                Coordinate.clamp(center.y() + radius), Coordinate.clamp(center.z() + radius));
    }

    public static boolean isWithinRadius(Coordinate point, Coordinate center, double radius) {
        return point.distanceSquared(center) <= radius * radius;
    }

    public static Optional<Coordinate> centroid(Collection<Coordinate> points) {
        if (points.isEmpty()) return Optional.empty();
        double sx = 0, sy = 0, sz = 0;
        for (Coordinate p : points) {
            sx += p.x();
            sy += p.y();
            sz += p.z();
        }
        int n = points.size();
        return Optional.of(new Coordinate(sx / n, sy / n, sz / n));
    }

    public static Optional<Coordinate> findClosest(Coordinate target, Collection<Coordinate> candidates) {
        Coordinate best = null;
        double bestDist = Double.POSITIVE_INFINITY;
        for (Coordinate c : candidates) {
            double d = c.distanceSquared(target);
            if (d < bestDist) {
                bestDist = d;
                best = c;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Clamped random perturbations of {@code center}, each axis offset uniformly in
     * {@code [-spread, spread]}.
     */
    public static List<Coordinate> generateVariations(Coordinate center, int count, double spread, Random random) {
        List<Coordinate> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            out.add(center.plus(
                    (random.nextDouble() * 2 - 1) * spread,
                    (random.nextDouble() * 2 - 1) * spread,
                    (random.nextDouble() * 2 - 1) * spread).clamp());
        }
        return out;
    }

    private static Map<PatternCategory, Coordinate> buildAnchors() {
        Map<PatternCategory, Coordinate> anchors = new EnumMap<>(PatternCategory.class);
        for (PatternCategory category : PatternCategory.values()) {
            Coordinate h = hashCoordinates(category.name(), "anchor");
            double x = category.neighborhood().isPresent()
                    ? category.neighborhood().getAsDouble() * 2.0 - 1.0
                    : h.x() * ANCHOR_SPREAD_X;
            anchors.put(category, new Coordinate(x, h.y() * ANCHOR_SPREAD_YZ, h.z() * ANCHOR_SPREAD_YZ));
        }
        return anchors;
    }

    private static double clamp01(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
