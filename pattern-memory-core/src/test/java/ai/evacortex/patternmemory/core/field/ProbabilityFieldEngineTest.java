/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.field;

import ai.evacortex.patternmemory.core.HarmonicProfile;
import ai.evacortex.patternmemory.core.PatternCategory;
import ai.evacortex.patternmemory.core.PatternTestUtils;
import ai.evacortex.patternmemory.core.exceptions.InvalidIntentException;
import ai.evacortex.patternmemory.core.geometry.Coordinate;
import ai.evacortex.patternmemory.core.geometry.CoordinateHasher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ProbabilityFieldEngineTest {

    private static final HarmonicProfile AUTH = HarmonicProfile.of("auth", 0.9, 0.8, 3.0, 10);

    private ProbabilityFieldEngine engine;

    @BeforeEach
    void setUp() {
        engine = new ProbabilityFieldEngine(FieldTuning.defaults(), new Random(7));
    }

    static Stream<Arguments> shapesAndFalloffs() {
        return Stream.of(FieldShape.values())
                .flatMap(shape -> Stream.of(Falloff.values()).map(falloff -> Arguments.of(shape, falloff)));
    }

    @ParameterizedTest
    @MethodSource("shapesAndFalloffs")
    void testCalculateProbability_isZeroOutsideRadiusAndBoundedInside(FieldShape shape, Falloff falloff) {
        Random random = new Random(11);
        ProbabilityField field = new ProbabilityField(new Coordinate(0.1, -0.1, 0.2), 0.4, shape, falloff,
                1.5, 2.0, 0.1, 0.6, 0.0);
        for (int i = 0; i < 2_000; i++) {
            Coordinate p = PatternTestUtils.randomCoordinate(random);
            double score = engine.calculateProbability(p, field);
            if (p.distanceTo(field.center()) > field.radius()) {
                assertEquals(0.0, score, "Points outside the radius must score exactly 0");
            } else {
                assertTrue(score >= 0.0 && score <= 1.0, "Score must be clamped to [0,1]: " + score);
            }
        }
    }

    @ParameterizedTest
    @CsvSource({
            "PRECISION, 0.5, 0.0, 0.2, SPHERICAL, EXPONENTIAL",
            "DISCOVERY, 0.5, 0.0, 0.5, ELLIPTICAL, POLYNOMIAL",
            "DISCOVERY, 0.5, 1.0, 0.8, ELLIPTICAL, POLYNOMIAL",
            "DISCOVERY, 0.2, 0.0, 0.75, ELLIPTICAL, POLYNOMIAL",
            "PRECISION, 0.9, 0.0, 0.084, SPHERICAL, EXPONENTIAL"
    })
    void testGenerateField_geometryPerQueryType(QueryType type, double confidence, double exploration,
                                                double expectedRadius, FieldShape shape, Falloff falloff) {
        QueryIntent intent = QueryIntent.builder(type)
                .signature(AUTH)
                .confidence(confidence)
                .exploration(exploration)
                .build();
        ProbabilityField field = engine.generateField(intent, QueryContext.EMPTY);

        assertEquals(expectedRadius, field.radius(), 1e-9, "Radius for " + type);
        assertEquals(shape, field.shape());
        assertEquals(falloff, field.falloff());
        assertEquals(CoordinateHasher.generateSemanticCoordinates(AUTH), field.center(),
                "Signature must center the field on its coordinate");
    }

    @Test
    void testGenerateField_creativeIsRandomizedWithinRange() {
        for (int i = 0; i < 50; i++) {
            ProbabilityField field = engine.generateField(QueryIntent.builder(QueryType.CREATIVE).build(), null);
            assertEquals(FieldShape.FRACTAL, field.shape());
            assertEquals(Falloff.GAUSSIAN, field.falloff());
            assertTrue(field.radius() >= 0.6 && field.radius() <= 0.8, "Creative radius out of range: " + field.radius());
            assertTrue(field.center().inRange());
        }
    }

    @Test
    void testGenerateField_isReproducibleWithSameSeed() {
        ProbabilityFieldEngine a = new ProbabilityFieldEngine(FieldTuning.defaults(), new Random(99));
        ProbabilityFieldEngine b = new ProbabilityFieldEngine(FieldTuning.defaults(), new Random(99));
        QueryIntent intent = QueryIntent.builder(QueryType.CREATIVE).build();
        assertEquals(a.generateField(intent, null), b.generateField(intent, null));
    }

    @Test
    void testUrgencyShrinksRadius() {
        QueryIntent intent = QueryIntent.builder(QueryType.PRECISION).signature(AUTH).urgencyMillis(50).build();
        assertEquals(0.16, engine.generateField(intent, QueryContext.EMPTY).radius(), 1e-9);
    }

    @Test
    void testHitRateAdjustsRadiusOnlyWithHistory() {
        QueryIntent intent = QueryIntent.builder(QueryType.DISCOVERY).signature(AUTH).build();
        QueryContext noHistory = new QueryContext(List.of(), List.of(), 0, 0.0, 0);
        QueryContext poorHits = new QueryContext(List.of(QueryType.DISCOVERY), List.of(), 100, 0.2, 5);
        QueryContext greatHits = new QueryContext(List.of(QueryType.DISCOVERY), List.of(), 100, 0.95, 5);

        assertEquals(0.5, engine.generateField(intent, noHistory).radius(), 1e-9,
                "Without history the hit rate must be ignored");
        assertEquals(0.6, engine.generateField(intent, poorHits).radius(), 1e-9);
        assertEquals(0.45, engine.generateField(intent, greatHits).radius(), 1e-9);
    }

    @Test
    void testRadiusOverrideIsClamped() {
        QueryIntent intent = QueryIntent.builder(QueryType.PRECISION).radius(100.0).build();
        assertEquals(FieldTuning.defaults().maxRadius(), engine.generateField(intent, null).radius(), 1e-9);
    }

    @Test
    void testPrecisionTurnsAdaptiveForFamiliarCategory() {
        QueryContext familiar = new QueryContext(List.of(QueryType.PRECISION),
                Collections.nCopies(4, PatternCategory.AUTHENTICATION), 100, 0.6, 4);
        QueryIntent intent = QueryIntent.builder(QueryType.PRECISION).signature(AUTH).build();

        ProbabilityField field = engine.generateField(intent, familiar);
        assertEquals(FieldShape.ADAPTIVE, field.shape());
        assertEquals(0.75, field.contextSensitivity(), 1e-9);
    }

    @Test
    void testMorphField_withoutElapsedTimeIsIdentity() {
        ProbabilityField field = engine.generateField(QueryIntent.builder(QueryType.DISCOVERY).signature(AUTH).build(), null);
        assertSame(field, engine.morphField(field, 0.0));
    }

    @Test
    void testMorphField_driftsSlightly() {
        ProbabilityField field = engine.generateField(QueryIntent.builder(QueryType.DISCOVERY).signature(AUTH).build(), null);
        ProbabilityField morphed = engine.morphField(field, 1.0);

        assertTrue(Math.abs(morphed.radius() - field.radius()) <= field.radius() * 0.1 * field.morphingRate() + 1e-12);
        assertTrue(morphed.center().distanceTo(field.center()) <= Math.sqrt(3) * 0.05 * field.morphingRate() + 1e-12);
    }

    @Test
    void testBreathingAndPulsing() {
        ProbabilityField field = new ProbabilityField(Coordinate.ORIGIN, 0.5, FieldShape.SPHERICAL,
                Falloff.POLYNOMIAL, 1.0, 1.5, 0.1, 0.5, 0.0);

        ProbabilityField peak = engine.applyBreathing(field, 0.25, 1.0);
        assertEquals(0.55, peak.radius(), 1e-9);
        assertEquals(1.05, peak.amplitude(), 1e-9);

        assertEquals(1.3, engine.applyPulsing(field, 0.0, 1.0).amplitude(), 1e-9);
        assertSame(field, engine.applyPulsing(field, 0.5, 1.0));
    }

    @Test
    void testInvalidIntentIsRejected() {
        assertThrows(InvalidIntentException.class, () -> QueryIntent.builder(QueryType.PRECISION).limit(0).build());
        assertThrows(InvalidIntentException.class, () -> QueryIntent.builder(QueryType.PRECISION).confidence(1.5).build());
        assertThrows(InvalidIntentException.class, () -> QueryIntent.builder(QueryType.DISCOVERY).radius(-0.2).build());
        assertThrows(InvalidIntentException.class, () -> QueryType.of("telepathic"));
        assertEquals(QueryType.DISCOVERY, QueryType.of(" discovery "));
    }
}
