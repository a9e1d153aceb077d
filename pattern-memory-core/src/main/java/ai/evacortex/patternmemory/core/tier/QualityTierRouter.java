/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.tier;

import ai.evacortex.patternmemory.core.AccessStats;
import ai.evacortex.patternmemory.core.HarmonicProfile;
import ai.evacortex.patternmemory.core.StorageTier;
import ai.evacortex.patternmemory.core.util.BoundedAuditLog;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Assigns patterns to storage tiers from their quality score and decides migrations.
 *
 * <p>Migration is monotonic with respect to the last evaluated score: a strictly higher score
 * never leads to a worse tier and a strictly lower score never leads to a better one.
 * Every accepted transition is appended to a bounded audit log.</p>
 */
public class QualityTierRouter {

    public record Assignment(StorageTier tier, double score) {}

    private final QualityScorer scorer;
    private final BoundedAuditLog<MigrationRecord> history;
    private final AtomicLong promoted = new AtomicLong();
    private final AtomicLong demoted = new AtomicLong();
    private final AtomicLong cycles = new AtomicLong();
    private final Map<MigrationRecord.Reason, AtomicLong> byReason = new EnumMap<>(MigrationRecord.Reason.class);

    public QualityTierRouter(TierPolicy policy, int auditWindow) {
        this.scorer = new QualityScorer(policy);
        this.history = new BoundedAuditLog<>(auditWindow);
        for (MigrationRecord.Reason r : MigrationRecord.Reason.values()) {
            byReason.put(r, new AtomicLong());
        }
    }

    public QualityScorer scorer() {
        return scorer;
    }

    public TierPolicy policy() {
        return scorer.policy();
    }

    public Assignment assign(HarmonicProfile profile, AccessStats access, long now) {
        double score = scorer.score(profile, access, now);
        return new Assignment(scorer.policy().tierFor(score), score);
    }

    /**
     * Proposes a transition for a re-scored placement, or empty if it should stay put.
     *
     * @param lastScore score at the previous evaluation, {@code NaN} if never evaluated
     */
    public Optional<MigrationRecord> evaluate(String id, HarmonicProfile profile, AccessStats access,
                                              StorageTier current, double lastScore, long now) {
        double score = scorer.score(profile, access, now);
        StorageTier target = scorer.policy().tierFor(score);
        if (target == current) return Optional.empty();

        if (!Double.isNaN(lastScore)) {
            if (score > lastScore && current.isBetterThan(target)) return Optional.empty();
            if (score < lastScore && target.isBetterThan(current)) return Optional.empty();
        }
        return Optional.of(new MigrationRecord(id, current, target,
                Double.isNaN(lastScore) ? score : lastScore, score, MigrationRecord.Reason.SCORE, now));
    }

    /**
     * Appends an applied transition to the audit log and updates counters.
     */
    public void record(MigrationRecord record) {
        history.append(record);
        byReason.get(record.reason()).incrementAndGet();
        if (record.isPromotion()) {
            promoted.incrementAndGet();
        } else if (record.from() != record.to()) {
            demoted.incrementAndGet();
        }
    }

    public long completeCycle() {
        return cycles.incrementAndGet();
    }

    public long promotedTotal() {
        return promoted.get();
    }

    public long demotedTotal() {
        return demoted.get();
    }

    public long cycles() {
        return cycles.get();
    }

    public long transitions(MigrationRecord.Reason reason) {
        return byReason.get(reason).get();
    }

    public List<MigrationRecord> history() {
        return history.snapshot();
    }
}
