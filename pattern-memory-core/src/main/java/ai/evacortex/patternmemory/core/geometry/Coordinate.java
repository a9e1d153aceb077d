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
 * Point in the bounded semantic space {@code [-1,1]^3}.
 */
public record Coordinate(double x, double y, double z) {

    public static final double MIN = -1.0;
    public static final double MAX = 1.0;
    public static final Coordinate ORIGIN = new Coordinate(0, 0, 0);

    public Coordinate {
        if (!Double.isFinite(x) || !Double.isFinite(y) || !Double.isFinite(z)) {
            throw new IllegalArgumentException("Non-finite coordinate: (" + x + ", " + y + ", " + z + ")");
        }
    }

    public double distanceTo(Coordinate other) {
        return Math.sqrt(distanceSquared(other));
    }

    public double distanceSquared(Coordinate other) {
        double dx = x - other.x;
        double dy = y - other.y;
        double dz = z - other.z;
        return dx * dx + dy * dy + dz * dz;
    }

    public double axis(int dim) {
        return switch (dim) {
            case 0 -> x;
            case 1 -> y;
            case 2 -> z;
            default -> throw new IllegalArgumentException("Axis out of range: " + dim);
        };
    }

    public boolean inRange() {
        return x >= MIN && x <= MAX && y >= MIN && y <= MAX && z >= MIN && z <= MAX;
    }

    public Coordinate clamp() {
        return inRange() ? this : new Coordinate(clamp(x), clamp(y), clamp(z));
    }

    public Coordinate plus(double dx, double dy, double dz) {
        return new Coordinate(x + dx, y + dy, z + dz);
    }

    static double clamp(double v) {
        return Math.max(MIN, Math.min(MAX, v));
    }
}
