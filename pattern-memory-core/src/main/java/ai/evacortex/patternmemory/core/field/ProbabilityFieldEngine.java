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
import ai.evacortex.patternmemory.core.geometry.Coordinate;
import ai.evacortex.patternmemory.core.geometry.CoordinateHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Random;

/**
 * Turns a {@link QueryIntent} into a {@link ProbabilityField} and scores candidate points.
 *
 * <p>Field geometry depends on the query type:</p>
 * <ul>
 *     <li>precision: small radius shrinking with confidence, exponential falloff;</li>
 *     <li>discovery: wide radius growing with exploration, elliptical shape, polynomial falloff;</li>
 *     <li>creative: randomized radius and amplitude, fractal shape, gaussian falloff.</li>
 * </ul>
 * The result is then adjusted for confidence, urgency and the recent hit rate.
 *
 * <p>All randomness comes from the injected {@link Random}, so a seeded engine is reproducible.</p>
 */
public class ProbabilityFieldEngine {

    private static final Logger log = LoggerFactory.getLogger(ProbabilityFieldEngine.class);

    private static final double MORPH_RADIUS_JITTER = 0.1;
    private static final double MORPH_CENTER_SPREAD = 0.05;
    private static final double MORPH_STEEPNESS_JITTER = 0.1;
    private static final double BREATHING_RADIUS = 0.1;
    private static final double BREATHING_AMPLITUDE = 0.05;
    private static final double PULSE_BOOST = 0.3;
    private static final double PULSE_DUTY = 0.2;
    private static final double NOISE_BASE_FREQUENCY = 4.0;

    private final FieldTuning tuning;
    private final Random random;

    public ProbabilityFieldEngine() {
        this(FieldTuning.defaults(), new Random());
    }

    public ProbabilityFieldEngine(FieldTuning tuning, Random random) {
        this.tuning = Objects.requireNonNull(tuning, "tuning");
        this.random = Objects.requireNonNull(random, "random");
    }

    public FieldTuning tuning() {
        return tuning;
    }

    public ProbabilityField generateField(QueryIntent intent, QueryContext context) {
        QueryContext ctx = context == null ? QueryContext.EMPTY : context;
        HarmonicProfile signature = intent.harmonicSignature();

        Coordinate center = signature != null
                ? CoordinateHasher.generateSemanticCoordinates(signature)
                : new Coordinate(uniform(-1, 1), uniform(-1, 1), uniform(-1, 1));

        double radius;
        double amplitude;
        double steepness;
        FieldShape shape;
        Falloff falloff;

        switch (intent.queryType()) {
            case PRECISION -> {
                FieldTuning.Geometry g = tuning.precision();
                radius = g.baseRadius() + (1.0 - intent.confidenceLevel()) * g.radiusSpan();
                amplitude = g.amplitude();
                steepness = g.steepness();
                shape = FieldShape.SPHERICAL;
                falloff = Falloff.EXPONENTIAL;
            }
            case DISCOVERY -> {
                FieldTuning.Geometry g = tuning.discovery();
                radius = g.baseRadius() + intent.explorationDesire() * g.radiusSpan();
                amplitude = g.amplitude();
                steepness = g.steepness();
                shape = FieldShape.ELLIPTICAL;
                falloff = Falloff.POLYNOMIAL;
            }
            case CREATIVE -> {
                FieldTuning.CreativeRange c = tuning.creative();
                radius = uniform(c.minRadius(), c.maxRadius());
                amplitude = uniform(c.minAmplitude(), c.maxAmplitude());
                steepness = uniform(c.minSteepness(), c.maxSteepness());
                shape = FieldShape.FRACTAL;
                falloff = Falloff.GAUSSIAN;
            }
            default -> throw new IllegalStateException("Unhandled query type " + intent.queryType());
        }

        FieldTuning.Adjustments adj = tuning.adjustments();
        if (intent.confidenceLevel() < adj.lowConfidence()) {
            radius *= adj.lowConfidenceRadius();
            amplitude *= adj.lowConfidenceAmplitude();
        } else if (intent.confidenceLevel() > adj.highConfidence()) {
            radius *= adj.highConfidenceRadius();
            amplitude *= adj.highConfidenceAmplitude();
        }

        if (intent.urgencyMillis() != null && intent.urgencyMillis() < adj.urgentMillis()) {
            radius *= adj.urgentRadius();
            steepness *= adj.urgentSteepness();
        }

        if (ctx.hasHistory()) {
            if (ctx.hitRate() > adj.highHitRate()) {
                radius *= adj.highHitRateRadius();
            } else if (ctx.hitRate() < adj.lowHitRate()) {
                radius *= adj.lowHitRateRadius();
            }
        }

        if (intent.radiusOverride() != null) {
            radius = intent.radiusOverride();
        }
        radius = Math.max(tuning.minRadius(), Math.min(tuning.maxRadius(), radius));

        double sensitivity = contextSensitivity(signature, ctx);
        if (intent.queryType() == QueryType.PRECISION && sensitivity >= tuning.adaptiveSensitivityThreshold()) {
            shape = FieldShape.ADAPTIVE;
        }

        ProbabilityField field = new ProbabilityField(center, radius, shape, falloff, amplitude, steepness,
                morphingRate(intent, ctx), sensitivity, intent.explorationDesire());
        log.debug("Generated {} field r={} shape={} falloff={}", intent.queryType(), radius, shape, falloff);
        return field;
    }

    /**
     * Score of {@code point} in [0,1]; exactly 0 when the point lies outside the field radius.
     */
    public double calculateProbability(Coordinate point, ProbabilityField field) {
        double d = point.distanceTo(field.center());
        if (!(d <= field.radius())) return 0.0;

        double base = field.falloff().apply(d, field.radius(), field.amplitude(), field.steepness());
        double multiplier = switch (field.shape()) {
            case SPHERICAL -> 1.0;
            case ELLIPTICAL -> 1.0 + tuning.ellipticalStretch() * Math.abs(point.x() - field.center().x()) / field.radius();
            case FRACTAL -> 0.7 + 0.3 * fractalNoise(point, tuning.fractalOctaves());
            case ADAPTIVE -> 0.8 + 0.2 * field.contextSensitivity();
        };

        double value = base * multiplier;
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * Small random drift of radius, center and steepness, scaled by the field's morphing rate
     * and the elapsed time (capped at one second).
     */
    public ProbabilityField morphField(ProbabilityField field, double deltaSeconds) {
        double drift = field.morphingRate() * Math.max(0.0, Math.min(1.0, deltaSeconds));
        if (drift == 0.0) return field;

        double radius = field.radius() * (1.0 + signed() * MORPH_RADIUS_JITTER * drift);
        double steepness = field.steepness() * (1.0 + signed() * MORPH_STEEPNESS_JITTER * drift);
        Coordinate center = CoordinateHasher.generateVariations(field.center(), 1, MORPH_CENTER_SPREAD * drift, random)
                .get(0);

        return field.withCenter(center)
                .withRadius(clampRadius(radius))
                .withSteepness(Math.max(1e-3, steepness));
    }

    /** Sinusoidal oscillation of radius (10%) and amplitude (5%). */
    public ProbabilityField applyBreathing(ProbabilityField field, double timeSeconds, double rate) {
        double phase = Math.sin(2 * Math.PI * rate * timeSeconds);
        return field.withRadius(clampRadius(field.radius() * (1.0 + BREATHING_RADIUS * phase)))
                .withAmplitude(field.amplitude() * (1.0 + BREATHING_AMPLITUDE * phase));
    }

    /** Periodic amplitude boost during the first fifth of every cycle. */
    public ProbabilityField applyPulsing(ProbabilityField field, double timeSeconds, double rate) {
        double cyclePosition = (timeSeconds * rate) % 1.0;
        if (cyclePosition < 0) cyclePosition += 1.0;
        return cyclePosition < PULSE_DUTY ? field.withAmplitude(field.amplitude() * (1.0 + PULSE_BOOST)) : field;
    }

    double morphingRate(QueryIntent intent, QueryContext ctx) {
        double rate = tuning.baseMorphingRate();
        if (intent.queryType() == QueryType.CREATIVE) rate *= 2.0;
        rate *= 1.0 + intent.explorationDesire();
        if (distinctTypes(ctx) > 2) rate *= 1.3;
        return Math.min(1.0, rate);
    }

    double contextSensitivity(HarmonicProfile signature, QueryContext ctx) {
        double sensitivity = 0.5;
        if (signature != null && ctx.categoryFrequency(signature.category()) > 3) {
            sensitivity *= 1.5;
        }
        if (ctx.hasHistory() && ctx.averageResponseMillis() < 50) {
            sensitivity *= 0.8;
        }
        return Math.min(1.0, sensitivity);
    }

    private static int distinctTypes(QueryContext ctx) {
        EnumSet<QueryType> types = EnumSet.noneOf(QueryType.class);
        types.addAll(ctx.recentQueryTypes());
        return types.size();
    }

    private double clampRadius(double r) {
        return Math.max(tuning.minRadius(), Math.min(tuning.maxRadius(), r));
    }

    private double uniform(double lo, double hi) {
        return lo + random.nextDouble() * (hi - lo);
    }

    private double signed() {
        return random.nextDouble() * 2.0 - 1.0;
    }

    /**
     * Deterministic value noise in [-1,1], summed over octaves of doubling frequency.
     */
    static double fractalNoise(Coordinate p, int octaves) {
        double sum = 0.0;
        double norm = 0.0;
        double amplitude = 1.0;
        double frequency = NOISE_BASE_FREQUENCY;
        for (int i = 0; i < octaves; i++) {
            sum += amplitude * valueNoise(p.x() * frequency, p.y() * frequency, p.z() * frequency);
            norm += amplitude;
            amplitude *= 0.5;
            frequency *= 2.0;
        }
        return sum / norm;
    }

    private static double valueNoise(double x, double y, double z) {
        int x0 = (int) Math.floor(x);
        int y0 = (int) Math.floor(y);
        int z0 = (int) Math.floor(z);
        double tx = smooth(x - x0);
        double ty = smooth(y - y0);
        double tz = smooth(z - z0);

        double c00 = lerp(lattice(x0, y0, z0), lattice(x0 + 1, y0, z0), tx);
        double c10 = lerp(lattice(x0, y0 + 1, z0), lattice(x0 + 1, y0 + 1, z0), tx);
        double c01 = lerp(lattice(x0, y0, z0 + 1), lattice(x0 + 1, y0, z0 + 1), tx);
        double c11 = lerp(lattice(x0, y0 + 1, z0 + 1), lattice(x0 + 1, y0 + 1, z0 + 1), tx);
        return lerp(lerp(c00, c10, ty), lerp(c01, c11, ty), tz);
    }

    private static double lattice(int x, int y, int z) {
        long h = x * 0x8da6b343L ^ y * 0xd8163841L ^ z * 0xcb1ab31fL;
        h ^= h >>> 13;
        h *= 0x5bd1e995L;
        h ^= h >>> 15;
        return ((h & 0xFFFFFFL) / (double) 0xFFFFFFL) * 2.0 - 1.0;
    }

    private static double smooth(double t) {
        return t * t * (3 - 2 * t);
    }

    private static double lerp(double a, double b, double t) {
        return a + (b - a) * t;
    }
}
