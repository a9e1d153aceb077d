/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.geometry;

/**
 * Axis-aligned box. Degenerate boxes (a single point, a plane) are valid.
 */
public record BoundingBox(double minX, double minY, double minZ,
                          double maxX, double maxY, double maxZ) {

    /** Extent padding used when comparing volumes of flat boxes. */
    private static final double PAD = 1e-6;

    public BoundingBox {
        if (minX > maxX || minY > maxY || minZ > maxZ) {
            throw new IllegalArgumentException("Inverted bounding box");
        }
    }

    public static BoundingBox of(Coordinate p) {
        return new BoundingBox(p.x(), p.y(), p.z(), p.x(), p.y(), p.z());
    }

    public BoundingBox union(BoundingBox o) {
        return new BoundingBox(
                Math.min(minX, o.minX), Math.min(minY, o.minY), Math.min(minZ, o.minZ),
                Math.max(maxX, o.maxX), Math.max(maxY, o.maxY), Math.max(maxZ, o.maxZ));
    }

    public BoundingBox union(Coordinate p) {
        return union(of(p));
    }

    public boolean contains(Coordinate p) {
        return p.x() >= minX && p.x() <= maxX
                && p.y() >= minY && p.y() <= maxY
                && p.z() >= minZ && p.z() <= maxZ;
    }

    public boolean contains(BoundingBox o) {
        return o.minX >= minX && o.maxX <= maxX
                && o.minY >= minY && o.maxY <= maxY
                && o.minZ >= minZ && o.maxZ <= maxZ;
    }

    /** Volume with every extent padded, so boxes flat along an axis still compare. */
    public double volume() {
        return (maxX - minX + PAD) * (maxY - minY + PAD) * (maxZ - minZ + PAD);
    }

    public double enlargement(BoundingBox added) {
        return union(added).volume() - volume();
    }

    /** Squared distance from {@code p} to the nearest point of this box; 0 when inside. */
    public double minDistanceSquared(Coordinate p) {
        double dx = axisGap(p.x(), minX, maxX);
        double dy = axisGap(p.y(), minY, maxY);
        double dz = axisGap(p.z(), minZ, maxZ);
        return dx * dx + dy * dy + dz * dz;
    }

    public Coordinate center() {
        return new Coordinate((minX + maxX) / 2, (minY + maxY) / 2, (minZ + maxZ) / 2);
    }

    private static double axisGap(double v, double lo, double hi) {
        if (v < lo) return lo - v;
        if (v > hi) return v - hi;
        return 0.0;
    }
}
