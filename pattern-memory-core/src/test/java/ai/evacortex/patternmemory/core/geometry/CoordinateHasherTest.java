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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class CoordinateHasherTest {

    private static final long SEED = 0xC0FFEEL;

    @Test
    void testGenerateSemanticCoordinates_isDeterministic() {
        HarmonicProfile profile = HarmonicProfile.of("auth", 0.9, 0.8, 3.0, 10);
        Coordinate first = CoordinateHasher.generateSemanticCoordinates(profile);
        for (int i = 0; i < 10; i++) {
            assertEquals(first, CoordinateHasher.generateSemanticCoordinates(profile),
                    "Same profile must always map to the same coordinate");
        }
    }

    @Test
    void testGenerateSemanticCoordinates_alwaysInRange() {
        Random random = new Random(SEED);
        PatternCategory[] categories = PatternCategory.values();
        for (int i = 0; i < 5_000; i++) {
            Coordinate c = CoordinateHasher.generateSemanticCoordinates(
                    categories[random.nextInt(categories.length)],
                    random.nextDouble(), random.nextDouble() * 50, 1 + random.nextInt(100_000));
            assertTrue(c.inRange(), "Coordinate out of [-1,1]^3: " + c);
        }
    }

    @Test
    void testToCoordinates_mapsSegmentExtremesToCubeCorners() {
        byte[] zeros = new byte[32];
        byte[] ones = new byte[32];
        Arrays.fill(ones, (byte) 0xFF);

        assertEquals(new Coordinate(-1, -1, -1), CoordinateHasher.toCoordinates(zeros));
        assertEquals(new Coordinate(1, 1, 1), CoordinateHasher.toCoordinates(ones));
    }

    @Test
    void testToCoordinates_rejectsShortDigest() {
        assertThrows(IllegalArgumentException.class, () -> CoordinateHasher.toCoordinates(new byte[11]));
    }

    @Test
    void testHash_isCaseInsensitiveOnCategory() {
        assertArrayEquals(CoordinateHasher.hash("auth", "x"), CoordinateHasher.hash("AUTH", "x"));
        assertEquals(CoordinateHasher.hashCoordinates("Auth", "x"), CoordinateHasher.hashCoordinates("AUTH", "x"));
    }

    @Test
    void testSameCategoryClusters() {
        List<Coordinate> cluster = List.of(
                CoordinateHasher.generateSemanticCoordinates(HarmonicProfile.of("auth", 0.9, 0.8, 3.0, 10)),
                CoordinateHasher.generateSemanticCoordinates(HarmonicProfile.of("auth", 0.85, 0.8, 3.0, 15)),
                CoordinateHasher.generateSemanticCoordinates(HarmonicProfile.of("auth", 0.95, 0.8, 3.0, 5)));
        for (Coordinate a : cluster) {
            for (Coordinate b : cluster) {
                assertTrue(a.distanceTo(b) <= 0.3, "Same-category patterns must cluster: " + a + " vs " + b);
            }
        }
    }

    @Test
    void testDistantNeighborhoodsStayApart() {
        Coordinate auth = CoordinateHasher.generateSemanticCoordinates(HarmonicProfile.of("auth", 0.9, 0.8, 3.0, 10));
        Coordinate errors = CoordinateHasher.generateSemanticCoordinates(HarmonicProfile.of("error", 0.9, 0.8, 3.0, 10));
        assertTrue(Math.abs(auth.x() - errors.x()) > 1.0,
                "Authentication and error neighborhoods must be far apart on x: " + auth + " vs " + errors);
    }

    @ParameterizedTest
    @EnumSource(PatternCategory.class)
    void testAnchorsAreDefinedForEveryCategory(PatternCategory category) {
        Coordinate anchor = CoordinateHasher.anchor(category);
        assertNotNull(anchor);
        assertTrue(anchor.inRange());
    }

    @Test
    void testBoundingBoxIsClamped() {
        BoundingBox box = CoordinateHasher.boundingBox(new Coordinate(0.95, -0.95, 0), 0.2);
        assertEquals(1.0, box.maxX(), 1e-12);
        assertEquals(-1.0, box.minY(), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> CoordinateHasher.boundingBox(Coordinate.ORIGIN, -0.1));
    }

    @Test
    void testIsWithinRadiusIncludesBoundary() {
        Coordinate point = new Coordinate(0.5, 0, 0);
        assertTrue(CoordinateHasher.isWithinRadius(point, Coordinate.ORIGIN, 0.5), "Boundary point is inside");
        assertFalse(CoordinateHasher.isWithinRadius(point, Coordinate.ORIGIN, 0.49));
    }

    @Test
    void testGenerateVariationsStayWithinSpread() {
        Random random = new Random(SEED);
        Coordinate center = new Coordinate(0.2, 0.2, 0.2);
        for (Coordinate v : CoordinateHasher.generateVariations(center, 200, 0.05, random)) {
            assertTrue(Math.abs(v.x() - center.x()) <= 0.05 + 1e-12);
            assertTrue(Math.abs(v.y() - center.y()) <= 0.05 + 1e-12);
            assertTrue(Math.abs(v.z() - center.z()) <= 0.05 + 1e-12);
        }
    }

    @Test
    void testCentroidAndClosest() {
        List<Coordinate> points = List.of(new Coordinate(0, 0, 0), new Coordinate(1, 0, 0), new Coordinate(0.5, 1, 0));
        assertEquals(new Coordinate(0.5, 1.0 / 3, 0), CoordinateHasher.centroid(points).orElseThrow());
        assertEquals(new Coordinate(1, 0, 0), CoordinateHasher.findClosest(new Coordinate(0.9, 0, 0), points).orElseThrow());
        assertTrue(CoordinateHasher.centroid(List.of()).isEmpty());
    }
}
