/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.engine;

import ai.evacortex.patternmemory.core.AccessStats;
import ai.evacortex.patternmemory.core.CodeLocation;
import ai.evacortex.patternmemory.core.HarmonicProfile;
import ai.evacortex.patternmemory.core.Pattern;
import ai.evacortex.patternmemory.core.PatternCategory;
import ai.evacortex.patternmemory.core.PatternRecord;
import ai.evacortex.patternmemory.core.StorageTier;
import ai.evacortex.patternmemory.core.cache.AggregateQuery;
import ai.evacortex.patternmemory.core.cache.CacheWarmer;
import ai.evacortex.patternmemory.core.cache.QueryMaterializer;
import ai.evacortex.patternmemory.core.cache.WarmingStats;
import ai.evacortex.patternmemory.core.dedup.DeduplicationResult;
import ai.evacortex.patternmemory.core.dedup.Deduplicator;
import ai.evacortex.patternmemory.core.dedup.PatternMerger;
import ai.evacortex.patternmemory.core.events.MemoryTracer;
import ai.evacortex.patternmemory.core.events.NoOpTracer;
import ai.evacortex.patternmemory.core.exceptions.EngineClosedException;
import ai.evacortex.patternmemory.core.exceptions.IndexInconsistencyException;
import ai.evacortex.patternmemory.core.exceptions.InvalidIntentException;
import ai.evacortex.patternmemory.core.exceptions.InvalidPatternException;
import ai.evacortex.patternmemory.core.exceptions.PatternNotFoundException;
import ai.evacortex.patternmemory.core.exceptions.TierExhaustedException;
import ai.evacortex.patternmemory.core.exceptions.TierUnavailableException;
import ai.evacortex.patternmemory.core.field.PatternFilter;
import ai.evacortex.patternmemory.core.field.ProbabilityField;
import ai.evacortex.patternmemory.core.field.ProbabilityFieldEngine;
import ai.evacortex.patternmemory.core.field.QueryContextTracker;
import ai.evacortex.patternmemory.core.field.QueryIntent;
import ai.evacortex.patternmemory.core.geometry.Coordinate;
import ai.evacortex.patternmemory.core.index.Neighbor;
import ai.evacortex.patternmemory.core.index.RTreeIndex;
import ai.evacortex.patternmemory.core.index.SpatialIndex;
import ai.evacortex.patternmemory.core.tier.InMemoryTierStore;
import ai.evacortex.patternmemory.core.tier.JsonFileTierStore;
import ai.evacortex.patternmemory.core.tier.MigrationRecord;
import ai.evacortex.patternmemory.core.tier.MigrationReport;
import ai.evacortex.patternmemory.core.tier.QualityTierRouter;
import ai.evacortex.patternmemory.core.tier.TierAdapter;
import ai.evacortex.patternmemory.core.tier.TierOutcome;
import ai.evacortex.patternmemory.core.tier.TierStore;
import ai.evacortex.patternmemory.core.util.AutoLock;
import ai.evacortex.patternmemory.core.util.BoundedAuditLog;
import ai.evacortex.patternmemory.core.util.StripedLocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;

/**
 * Default {@link PatternMemory}: an R-tree over semantic coordinates, a placement directory
 * and one {@link TierAdapter} per storage tier.
 *
 * <p>The tier stores are authoritative. The directory (id to tier, coordinate, profile and
 * access statistics) and the index are derived from them on open and can be rebuilt at any
 * time with {@link #checkConsistency(boolean)}. Structural changes to the directory and the
 * index happen together under one fair write lock; tier I/O never runs under that lock
 * except to roll back a failed placement.</p>
 *
 * <p>Every writer of a pattern (store, eviction, migration, merge, access write-back) holds
 * that pattern's placement lock from the first tier write until the old copy is deleted.
 * Maintenance re-checks the placement revision under the lock and skips patterns that were
 * replaced in the meantime. Locks are taken in the order maintenance monitor, warmer,
 * placement locks, write lock.</p>
 */
public class PatternMemoryEngine implements PatternMemory {

    private static final Logger log = LoggerFactory.getLogger(PatternMemoryEngine.class);

    static final String MAINTENANCE_THREAD = "pattern-memory-maintenance";
    private static final double MAX_DISTANCE = 2.0 * Math.sqrt(3.0);
    private static final int PLACEMENT_STRIPES = 64;
    private static final Comparator<ScoredPattern> RANKING =
            Comparator.comparingDouble(ScoredPattern::score).reversed().thenComparing(ScoredPattern::id);

    /**
     * Directory entry of one pattern. {@code revision} changes whenever the record held by the
     * tiers is replaced or moved, never on access bookkeeping.
     */
    private record Placement(String id,
                             StorageTier tier,
                             Coordinate coordinate,
                             HarmonicProfile profile,
                             AccessStats access,
                             double lastScore,
                             long lastEvaluatedAccessCount,
                             long lastEvaluatedAt,
                             boolean dirty,
                             long revision) {

        static Placement of(PatternRecord record, long evaluatedAt, long revision) {
            double score = record.access().relevance();
            return new Placement(record.id(), record.tier(), record.pattern().coordinate(),
                    record.pattern().profile(), record.access(), score > 0 ? score : Double.NaN,
                    record.access().accessCount(), evaluatedAt, false, revision);
        }

        Placement accessed(long now) {
            return new Placement(id, tier, coordinate, profile, access.recordAccess(now), lastScore,
                    lastEvaluatedAccessCount, lastEvaluatedAt, true, revision);
        }

        Placement evaluated(double score, long now) {
            return new Placement(id, tier, coordinate, profile, access.withRelevance(score), score,
                    access.accessCount(), now, dirty, revision);
        }

        Placement movedTo(StorageTier to, double score, long now, long writtenAccessCount, long newRevision) {
            return new Placement(id, to, coordinate, profile, access.withRelevance(score), score,
                    writtenAccessCount, now, access.accessCount() != writtenAccessCount, newRevision);
        }

        Placement withAccess(AccessStats newAccess, boolean isDirty) {
            return new Placement(id, tier, coordinate, profile, newAccess, lastScore,
                    lastEvaluatedAccessCount, lastEvaluatedAt, isDirty, revision);
        }

        boolean sameRevision(Placement other) {
            return other != null && tier == other.tier && revision == other.revision;
        }
    }

    private record Move(Placement placement, MigrationRecord transition) {}

    private record Fetch(Map<String, PatternRecord> found,
                         Set<StorageTier> consulted,
                         Set<StorageTier> failed,
                         Set<String> missing) {

        boolean exhausted() {
            return found.isEmpty() && !consulted.isEmpty() && failed.containsAll(consulted);
        }
    }

    private record TierScan(Map<String, PatternRecord> records, Set<String> duplicated, List<PatternRecord> staleCopies) {}

    private final MemoryEngineConfig config;
    private final MemoryTracer tracer;
    private final Clock clock;

    private final ReadWriteLock lock = AutoLock.fairReadWriteLock();
    private final StripedLocks placementLocks = new StripedLocks(PLACEMENT_STRIPES);
    private final AtomicLong revisions = new AtomicLong();
    private final SpatialIndex index;
    private final Map<String, Placement> directory = new ConcurrentHashMap<>();
    private final Map<StorageTier, TierAdapter> tiers = new EnumMap<>(StorageTier.class);
    private final Queue<PatternRecord> pendingWrites = new ConcurrentLinkedQueue<>();

    private final ExecutorService ioExecutor;
    private final ScheduledExecutorService scheduler;

    private final ProbabilityFieldEngine fieldEngine;
    private final QueryContextTracker contextTracker;
    private final QualityTierRouter router;
    private final Deduplicator deduplicator;
    private final CacheWarmer warmer;
    private final QueryMaterializer materializer;
    private final BoundedAuditLog<DeduplicationResult> dedupHistory;

    private final Object maintenanceMonitor = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean repairing = new AtomicBoolean(false);
    private final AtomicLong dedupRuns = new AtomicLong();

    public PatternMemoryEngine(MemoryEngineConfig config, Map<StorageTier, TierStore> stores, MemoryTracer tracer) {
        this(config, stores, tracer, Clock.systemUTC());
    }

    public PatternMemoryEngine(MemoryEngineConfig config, Map<StorageTier, TierStore> stores,
                               MemoryTracer tracer, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.tracer = tracer == null ? NoOpTracer.INSTANCE : tracer;
        this.clock = Objects.requireNonNull(clock, "clock");
        for (StorageTier tier : StorageTier.values()) {
            if (stores.get(tier) == null) throw new IllegalArgumentException("No store configured for tier " + tier);
        }

        this.index = new RTreeIndex(config.indexNodeCapacity());
        this.ioExecutor = Executors.newFixedThreadPool(config.ioThreads(), daemonThreads("pattern-memory-io"));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, MAINTENANCE_THREAD);
            t.setDaemon(true);
            return t;
        });
        for (StorageTier tier : StorageTier.values()) {
            tiers.put(tier, new TierAdapter(tier, stores.get(tier), ioExecutor,
                    config.tierTimeout(), config.writeRetries(), config.retryBackoff()));
        }

        this.fieldEngine = new ProbabilityFieldEngine(config.fieldTuning(), new Random(config.fieldSeed()));
        this.contextTracker = new QueryContextTracker(config.contextWindow());
        this.router = new QualityTierRouter(config.tierPolicy(), config.auditWindow());
        this.deduplicator = new Deduplicator(config.dedup(), p -> router.scorer().baseScore(p.profile()));
        this.warmer = new CacheWarmer(config.warmTopN(), config.hotCacheSize(), config.hotCacheExpiry(),
                config.warmStrategies());
        this.materializer = new QueryMaterializer(config.materializeTtl(), config.materializeMaxViews(),
                config.materializeMinAccess(), config.materializeMinComputeMillis());
        this.dedupHistory = new BoundedAuditLog<>(config.auditWindow());

        try {
            TierScan scan = scanTiers();
            if (!scan.duplicated().isEmpty()) {
                log.warn("{} patterns are held by more than one tier; run checkConsistency(true) to clean up",
                        scan.duplicated().size());
            }
            rebuild(scan.records().values());
        } catch (RuntimeException e) {
            shutdownExecutors();
            throw e;
        }
        scheduleMaintenance();
        log.info("Pattern memory opened with {} placements ({} indexed)", directory.size(), index.size());
    }

    public static PatternMemoryEngine inMemory(MemoryEngineConfig config) {
        return inMemory(config, Clock.systemUTC());
    }

    public static PatternMemoryEngine inMemory(MemoryEngineConfig config, Clock clock) {
        Map<StorageTier, TierStore> stores = new EnumMap<>(StorageTier.class);
        for (StorageTier tier : StorageTier.values()) stores.put(tier, new InMemoryTierStore());
        return new PatternMemoryEngine(config, stores, NoOpTracer.INSTANCE, clock);
    }

    /**
     * Opens an engine persisting every tier as {@code <dir>/tiers/<tier>.json}.
     */
    public static PatternMemoryEngine openOnDisk(Path dir, MemoryEngineConfig config) {
        return openOnDisk(dir, config, NoOpTracer.INSTANCE, Clock.systemUTC());
    }

    public static PatternMemoryEngine openOnDisk(Path dir, MemoryEngineConfig config, MemoryTracer tracer, Clock clock) {
        Map<StorageTier, TierStore> stores = new EnumMap<>(StorageTier.class);
        Path tierDir = dir.resolve("tiers");
        for (StorageTier tier : StorageTier.values()) {
            stores.put(tier, JsonFileTierStore.loadOrCreate(tier,
                    tierDir.resolve(tier.name().toLowerCase(Locale.ROOT) + ".json")));
        }
        return new PatternMemoryEngine(config, stores, tracer, clock);
    }

    public MemoryEngineConfig config() {
        return config;
    }

    // ---------------------------------------------------------------- ingestion

    @Override
    public StoreOutcome store(Pattern pattern) {
        ensureOpen();
        if (pattern == null) throw new InvalidPatternException("pattern must not be null");
        long now = clock.millis();

        if (!directory.containsKey(pattern.id()) && config.dedupOnStore()) {
            Optional<PatternRecord> duplicate = findStoredDuplicate(pattern);
            if (duplicate.isPresent()) return mergeInto(duplicate.get(), pattern, now);
        }
        try (StripedLocks.Held ignored = placementLocks.lock(pattern.id())) {
            return placeNew(pattern, now);
        }
    }

    /** Caller holds the placement lock of {@code pattern.id()}. */
    private StoreOutcome placeNew(Pattern pattern, long now) {
        Placement existing = directory.get(pattern.id());
        AccessStats access = existing != null ? existing.access() : AccessStats.fresh(now);
        QualityTierRouter.Assignment assignment = router.assign(pattern.profile(), access, now);
        PatternRecord record = new PatternRecord(pattern, assignment.tier(), access.withRelevance(assignment.score()));
        return place(record, assignment.tier().isQueryFacing() ? StoreOutcome.STORED : StoreOutcome.REJECTED_TIER);
    }

    @Override
    public BatchStoreResult storeBatch(Collection<Pattern> patterns) {
        ensureOpen();
        int stored = 0;
        int merged = 0;
        int queued = 0;
        int rejected = 0;
        int failed = 0;
        List<BatchStoreResult.Failure> failures = new ArrayList<>();
        int position = 0;
        for (Pattern p : patterns) {
            try {
                switch (store(p)) {
                    case STORED -> stored++;
                    case MERGED -> merged++;
                    case QUEUED -> queued++;
                    case REJECTED_TIER -> rejected++;
                }
            } catch (InvalidPatternException e) {
                failed++;
                failures.add(new BatchStoreResult.Failure(position, e.getMessage()));
            }
            position++;
        }
        log.debug("Stored batch of {}: {} stored, {} merged, {} queued, {} rejected, {} failed",
                position, stored, merged, queued, rejected, failed);
        return new BatchStoreResult(stored, merged, queued, rejected, failed, failures);
    }

    private Optional<PatternRecord> findStoredDuplicate(Pattern pattern) {
        List<String> near;
        try (AutoLock ignored = AutoLock.read(lock)) {
            near = index.rangeQuery(pattern.coordinate(), config.dedup().candidateRadius());
        }
        if (near.isEmpty()) return Optional.empty();
        Fetch fetched = fetch(near, true);
        List<Pattern> neighbours = fetched.found().values().stream().map(PatternRecord::pattern).toList();
        return deduplicator.findDuplicateOf(pattern, neighbours).map(d -> fetched.found().get(d.id()));
    }

    private StoreOutcome mergeInto(PatternRecord candidate, Pattern incoming, long now) {
        try (StripedLocks.Held ignored = placementLocks.lockAll(List.of(candidate.id(), incoming.id()))) {
            Placement current = directory.get(candidate.id());
            PatternRecord target = current == null ? null : loadRecord(current);
            if (target == null || directory.containsKey(incoming.id())
                    || !deduplicator.similarity().isDuplicate(incoming, target.pattern())) {
                return placeNew(incoming, now);
            }
            return mergeLocked(target, current, incoming, now);
        }
    }

    private StoreOutcome mergeLocked(PatternRecord target, Placement current, Pattern incoming, long now) {
        Pattern merged = PatternMerger.merge(target.pattern(), List.of(incoming));
        AccessStats access = current.access();
        QualityTierRouter.Assignment assignment = router.assign(merged.profile(), access, now);
        PatternRecord record = new PatternRecord(merged, assignment.tier(), access.withRelevance(assignment.score()));

        StoreOutcome outcome = place(record, StoreOutcome.MERGED);
        if (outcome == StoreOutcome.MERGED) {
            warmer.forget(incoming.id());
            tracer.onMerged(target.id(), List.of(incoming.id()));
            if (current.tier() != assignment.tier()) {
                recordTransition(new MigrationRecord(target.id(), current.tier(), assignment.tier(),
                        current.lastScore(), assignment.score(), MigrationRecord.Reason.MERGE, now));
            }
        }
        return outcome;
    }

    /**
     * Writes a record to its tier, then publishes it in the directory and the index. Caller
     * holds the placement lock of the record's id.
     */
    private StoreOutcome place(PatternRecord record, StoreOutcome onSuccess) {
        String id = record.id();
        StorageTier tier = record.tier();
        pendingWrites.removeIf(r -> r.id().equals(id) && r != record);

        TierOutcome<PatternRecord> written = tiers.get(tier).put(record);
        if (written.isFailure()) {
            pendingWrites.add(record);
            tracer.onTierDegraded(tier, written.status());
            tracer.onStored(id, tier, StoreOutcome.QUEUED.name());
            log.warn("Write of {} to {} failed ({}); queued for retry", id, tier, written.detail());
            return StoreOutcome.QUEUED;
        }

        Placement previous;
        try (AutoLock ignored = AutoLock.write(lock)) {
            previous = directory.get(id);
            try {
                if (tier.isQueryFacing()) {
                    index.insert(id, record.pattern().coordinate());
                } else {
                    index.remove(id);
                }
            } catch (RuntimeException e) {
                if (previous == null || previous.tier() != tier) tiers.get(tier).delete(id);
                throw e;
            }
            Placement placed = Placement.of(record, clock.millis(), revisions.incrementAndGet());
            if (previous != null && previous.access().accessCount() > record.access().accessCount()) {
                placed = placed.withAccess(previous.access().withRelevance(record.access().relevance()), true);
            }
            directory.put(id, placed);
        }

        if (previous != null && previous.tier() != tier) {
            deleteStaleCopy(id, previous.tier());
            materializer.invalidate(QueryMaterializer.Dependency.TIERS);
        } else if (previous == null) {
            materializer.invalidate(QueryMaterializer.Dependency.TIERS);
        }
        warmer.refresh(record.pattern());
        materializer.invalidate(QueryMaterializer.Dependency.PATTERNS);
        tracer.onStored(id, tier, onSuccess.name());
        log.debug("Placed {} in {} ({})", id, tier, onSuccess);
        return onSuccess;
    }

    @Override
    public int retryPendingWrites() {
        ensureOpen();
        List<PatternRecord> queued = new ArrayList<>(pendingWrites);
        int placed = 0;
        for (PatternRecord record : queued) {
            try (StripedLocks.Held ignored = placementLocks.lock(record.id())) {
                // gone from the queue: superseded by a newer store or evicted
                if (!pendingWrites.remove(record)) continue;
                StoreOutcome outcome = place(record,
                        record.tier().isQueryFacing() ? StoreOutcome.STORED : StoreOutcome.REJECTED_TIER);
                if (outcome != StoreOutcome.QUEUED) placed++;
            }
        }
        if (placed > 0) log.info("{} queued patterns became visible, {} still pending", placed, pendingWrites.size());
        return placed;
    }

    // ---------------------------------------------------------------- queries

    @Override
    public QueryResult query(QueryIntent intent) {
        ensureOpen();
        if (intent == null) throw new InvalidIntentException("intent must not be null");
        ProbabilityField field = fieldEngine.generateField(intent, contextTracker.snapshot());
        return execute(intent, field);
    }

    QueryResult execute(QueryIntent intent, ProbabilityField field) {
        ensureOpen();
        long start = System.nanoTime();

        List<String> candidates;
        try (AutoLock ignored = AutoLock.read(lock)) {
            candidates = index.rangeQuery(field.center(), field.radius());
        }
        Fetch fetched = fetch(candidates, true);
        if (fetched.exhausted()) {
            log.warn("Query failed: every consulted tier {} failed", fetched.failed());
            throw new TierExhaustedException(fetched.failed());
        }

        PatternFilter filter = intent.filter();
        List<ScoredPattern> scored = new ArrayList<>();
        for (PatternRecord r : fetched.found().values()) {
            Pattern p = r.pattern();
            if (!filter.accepts(p)) continue;
            double score = fieldEngine.calculateProbability(p.coordinate(), field);
            if (score <= 0) continue;
            score = Math.min(1.0, score * filter.boostFor(p));
            if (score <= 0) continue;
            scored.add(new ScoredPattern(p, r.tier(), score, p.coordinate().distanceTo(field.center())));
        }
        scored.sort(RANKING);
        List<ScoredPattern> results = scored.size() > intent.limit() ? scored.subList(0, intent.limit()) : scored;

        long now = clock.millis();
        for (ScoredPattern s : results) recordAccess(s.id(), now);
        if (!results.isEmpty()) materializer.invalidate(QueryMaterializer.Dependency.ACCESS);

        long elapsed = (System.nanoTime() - start) / 1_000_000;
        PatternCategory category = intent.harmonicSignature() == null ? null : intent.harmonicSignature().category();
        contextTracker.record(intent.queryType(), category, elapsed, !results.isEmpty());

        if (!fetched.missing().isEmpty()) onMissingRecords(fetched.missing());
        boolean degraded = !fetched.failed().isEmpty();
        if (degraded) log.warn("Degraded {} query: omitted tiers {}", intent.queryType(), fetched.failed());
        return new QueryResult(results, degraded, fetched.failed(), field, elapsed);
    }

    @Override
    public Optional<Pattern> get(String id) {
        ensureOpen();
        if (id == null) return Optional.empty();
        try {
            return Optional.of(read(id));
        } catch (PatternNotFoundException e) {
            log.debug("Lookup found nothing for {}", e.patternId());
            return Optional.empty();
        }
    }

    private Pattern read(String id) {
        for (int attempt = 0; attempt < 2; attempt++) {
            Placement p = directory.get(id);
            if (p == null) break;
            long now = clock.millis();

            Optional<Pattern> hot = warmer.getIfHot(id);
            if (hot.isPresent()) {
                recordAccess(id, now);
                return hot.get();
            }
            TierOutcome<PatternRecord> outcome = tiers.get(p.tier()).get(id);
            if (outcome.isOk()) {
                recordAccess(id, now);
                return outcome.value().pattern();
            }
            if (outcome.isFailure()) {
                tracer.onTierDegraded(p.tier(), outcome.status());
                throw new TierExhaustedException(EnumSet.of(p.tier()));
            }
            Placement latest = directory.get(id);
            if (latest != null && latest.tier() == p.tier()) {
                onMissingRecords(List.of(id));
                break;
            }
        }
        throw new PatternNotFoundException(id);
    }

    @Override
    public List<ScoredPattern> findSimilar(String id, int k) {
        ensureOpen();
        if (k < 1) throw new IllegalArgumentException("k must be >= 1");
        List<Neighbor> neighbours;
        try (AutoLock ignored = AutoLock.read(lock)) {
            if (!index.contains(id)) return List.of();
            neighbours = index.kNearest(id, k);
        }
        Fetch fetched = fetch(neighbours.stream().map(Neighbor::id).toList(), true);
        if (fetched.exhausted()) throw new TierExhaustedException(fetched.failed());

        List<ScoredPattern> out = new ArrayList<>(neighbours.size());
        for (Neighbor n : neighbours) {
            PatternRecord r = fetched.found().get(n.id());
            if (r == null) continue;
            out.add(new ScoredPattern(r.pattern(), r.tier(), Math.max(0.0, 1.0 - n.distance() / MAX_DISTANCE), n.distance()));
        }
        if (!fetched.missing().isEmpty()) onMissingRecords(fetched.missing());
        return out;
    }

    @Override
    public List<Pattern> queryByCategory(PatternCategory category, int limit) {
        ensureOpen();
        Objects.requireNonNull(category, "category");
        List<String> ids = directory.values().stream()
                .filter(p -> p.tier().isQueryFacing() && p.profile().category() == category)
                .sorted(Comparator.comparingDouble(this::rankScore).reversed().thenComparing(Placement::id))
                .limit(limit)
                .map(Placement::id)
                .toList();
        return patternsOf(ids);
    }

    @Override
    public List<Pattern> queryByStrength(double minStrength, int limit) {
        ensureOpen();
        List<String> ids = directory.values().stream()
                .filter(p -> p.tier().isQueryFacing() && p.profile().strength() >= minStrength)
                .sorted(Comparator.comparingDouble((Placement p) -> p.profile().strength()).reversed()
                        .thenComparing(Placement::id))
                .limit(limit)
                .map(Placement::id)
                .toList();
        return patternsOf(ids);
    }

    private List<Pattern> patternsOf(List<String> ids) {
        if (ids.isEmpty()) return List.of();
        Fetch fetched = fetch(ids, true);
        if (fetched.exhausted()) throw new TierExhaustedException(fetched.failed());
        List<Pattern> out = new ArrayList<>(ids.size());
        for (String id : ids) {
            PatternRecord r = fetched.found().get(id);
            if (r != null) out.add(r.pattern());
        }
        return out;
    }

    private double rankScore(Placement p) {
        return Double.isNaN(p.lastScore()) ? router.scorer().baseScore(p.profile()) : p.lastScore();
    }

    /**
     * Reads records for the given ids from their tiers, concurrently per tier. Hot-cache copies
     * are used when {@code useHotCache} is set.
     */
    private Fetch fetch(Collection<String> ids, boolean useHotCache) {
        Map<String, PatternRecord> found = new LinkedHashMap<>();
        Map<StorageTier, List<String>> byTier = new EnumMap<>(StorageTier.class);
        for (String id : ids) {
            Placement p = directory.get(id);
            if (p == null) continue;
            if (useHotCache) {
                Optional<Pattern> hot = warmer.getIfHot(id);
                if (hot.isPresent()) {
                    found.put(id, new PatternRecord(hot.get(), p.tier(), p.access()));
                    continue;
                }
            }
            byTier.computeIfAbsent(p.tier(), t -> new ArrayList<>()).add(id);
        }

        Map<StorageTier, CompletableFuture<TierOutcome<Map<String, PatternRecord>>>> pending = new EnumMap<>(StorageTier.class);
        byTier.forEach((tier, tierIds) -> pending.put(tier, tiers.get(tier).getAllAsync(tierIds)));

        Set<StorageTier> failed = EnumSet.noneOf(StorageTier.class);
        Set<String> missing = new TreeSet<>();
        pending.forEach((tier, future) -> {
            TierOutcome<Map<String, PatternRecord>> outcome = future.join();
            if (outcome.isFailure()) {
                failed.add(tier);
                tracer.onTierDegraded(tier, outcome.status());
                return;
            }
            for (String id : byTier.get(tier)) {
                PatternRecord r = outcome.value().get(id);
                if (r == null) {
                    Placement latest = directory.get(id);
                    if (latest != null && latest.tier() == tier) missing.add(id);
                } else {
                    found.put(id, r.tier() == tier ? r : r.withTier(tier));
                }
            }
        });
        Set<StorageTier> consulted = byTier.isEmpty() ? EnumSet.noneOf(StorageTier.class) : EnumSet.copyOf(byTier.keySet());
        return new Fetch(found, consulted, failed, missing);
    }

    private void recordAccess(String id, long now) {
        directory.computeIfPresent(id, (k, p) -> p.accessed(now));
        warmer.recordAccess(id, now);
    }

    private void onMissingRecords(Collection<String> ids) {
        String description = "placements without tier records: " + ids;
        log.warn("Integrity event, {}", description);
        tracer.onIntegrityEvent(description);
        if (!repairing.compareAndSet(false, true)) return;
        try {
            checkConsistency(true);
        } catch (RuntimeException e) {
            log.warn("Repair after integrity event failed: {}", e.toString());
        } finally {
            repairing.set(false);
        }
    }

    // ---------------------------------------------------------------- eviction

    @Override
    public boolean evict(String id) {
        ensureOpen();
        if (id == null) return false;
        try (StripedLocks.Held ignored = placementLocks.lock(id)) {
            return evictLocked(id);
        }
    }

    private boolean evictLocked(String id) {
        boolean wasPending = pendingWrites.removeIf(r -> r.id().equals(id));
        Placement p = directory.get(id);
        if (p == null) {
            if (wasPending) {
                warmer.forget(id);
                tracer.onEvicted(id);
            }
            return wasPending;
        }

        TierOutcome<Boolean> deleted = tiers.get(p.tier()).delete(id);
        if (deleted.isFailure()) {
            tracer.onTierDegraded(p.tier(), deleted.status());
            throw new TierUnavailableException(p.tier(), "failed to evict " + id + ": " + deleted.detail());
        }

        try (AutoLock ignored = AutoLock.write(lock)) {
            directory.remove(id);
            index.remove(id);
        }

        warmer.forget(id);
        materializer.invalidate(QueryMaterializer.Dependency.PATTERNS);
        materializer.invalidate(QueryMaterializer.Dependency.TIERS);
        tracer.onEvicted(id);
        log.debug("Evicted {} from {}", id, p.tier());
        return true;
    }

    // ---------------------------------------------------------------- migration

    @Override
    public MigrationReport migrate() {
        ensureOpen();
        synchronized (maintenanceMonitor) {
            return runMigrationCycle();
        }
    }

    private MigrationReport runMigrationCycle() {
        long started = System.nanoTime();
        long now = clock.millis();
        long rescoreMillis = config.rescoreInterval().toMillis();
        int batchSize = config.migrationBatchSize();

        List<String> ids = new ArrayList<>(directory.keySet());
        Collections.sort(ids);
        int evaluated = 0;
        int promoted = 0;
        int demoted = 0;

        for (int from = 0; from < ids.size(); from += batchSize) {
            List<Move> moves = new ArrayList<>();
            List<Placement> dirty = new ArrayList<>();
            for (String id : ids.subList(from, Math.min(ids.size(), from + batchSize))) {
                Placement p = directory.get(id);
                if (p == null) continue;
                boolean due = p.access().accessCount() != p.lastEvaluatedAccessCount()
                        || now - p.lastEvaluatedAt() >= rescoreMillis;
                if (due) {
                    evaluated++;
                    Optional<MigrationRecord> transition =
                            router.evaluate(id, p.profile(), p.access(), p.tier(), p.lastScore(), now);
                    if (transition.isPresent()) {
                        moves.add(new Move(p, transition.get()));
                        continue;
                    }
                    double score = router.scorer().score(p.profile(), p.access(), now);
                    directory.computeIfPresent(id, (k, cur) -> cur.sameRevision(p) ? cur.evaluated(score, now) : cur);
                }
                Placement latest = directory.get(id);
                if (latest != null && latest.dirty()) dirty.add(latest);
            }

            for (MigrationRecord applied : applyMoves(moves, now)) {
                if (applied.isPromotion()) promoted++; else demoted++;
            }
            writeBackAccess(dirty);
            Thread.yield();
        }

        long cycles = router.completeCycle();
        if (promoted + demoted > 0) {
            materializer.invalidate(QueryMaterializer.Dependency.TIERS);
            materializer.invalidate(QueryMaterializer.Dependency.PATTERNS);
        }
        long duration = (System.nanoTime() - started) / 1_000_000;
        log.debug("Migration cycle {}: {} evaluated, {} promoted, {} demoted in {} ms",
                cycles, evaluated, promoted, demoted, duration);
        return new MigrationReport(promoted, demoted, cycles, evaluated, duration);
    }

    /**
     * Moves records between tiers: put to the target tier, publish under the write lock, then
     * delete from the source tier. The placement locks of all moved ids are held throughout, and
     * a move is skipped when its placement was replaced after it was evaluated.
     *
     * @return the transitions that were applied
     */
    private List<MigrationRecord> applyMoves(List<Move> moves, long now) {
        if (moves.isEmpty()) return List.of();

        List<String> ids = moves.stream().map(m -> m.transition().patternId()).toList();
        try (StripedLocks.Held ignored = placementLocks.lockAll(ids)) {
            Map<Move, PatternRecord> written = new LinkedHashMap<>();
            for (Move m : moves) {
                MigrationRecord t = m.transition();
                Placement cur = directory.get(t.patternId());
                if (!m.placement().sameRevision(cur)) {
                    log.debug("Migration of {} skipped: placement changed since evaluation", t.patternId());
                    continue;
                }
                PatternRecord record = loadRecord(cur);
                if (record == null) continue;
                PatternRecord moved = new PatternRecord(record.pattern(), t.to(), cur.access().withRelevance(t.score()));
                TierOutcome<PatternRecord> put = tiers.get(t.to()).put(moved);
                if (put.isFailure()) {
                    tracer.onTierDegraded(t.to(), put.status());
                    log.warn("Migration of {} to {} skipped: {}", t.patternId(), t.to(), put.detail());
                    continue;
                }
                written.put(m, moved);
            }

            List<MigrationRecord> applied = new ArrayList<>();
            try (AutoLock ignored2 = AutoLock.write(lock)) {
                for (Map.Entry<Move, PatternRecord> e : written.entrySet()) {
                    MigrationRecord t = e.getKey().transition();
                    long writtenAccessCount = e.getValue().access().accessCount();
                    directory.computeIfPresent(t.patternId(), (k, cur) -> cur.movedTo(t.to(), t.score(), now,
                            writtenAccessCount, revisions.incrementAndGet()));
                    if (!t.to().isQueryFacing()) {
                        index.remove(t.patternId());
                    } else if (!t.from().isQueryFacing()) {
                        index.insert(t.patternId(), e.getKey().placement().coordinate());
                    }
                    applied.add(t);
                }
            }

            for (MigrationRecord t : applied) {
                deleteStaleCopy(t.patternId(), t.from());
                recordTransition(t);
            }
            return applied;
        }
    }

    private void recordTransition(MigrationRecord record) {
        router.record(record);
        tracer.onMigrated(record);
    }

    private void writeBackAccess(List<Placement> dirty) {
        for (Placement p : dirty) {
            try (StripedLocks.Held ignored = placementLocks.lock(p.id())) {
                Placement cur = directory.get(p.id());
                if (!p.sameRevision(cur)) continue;
                PatternRecord record = loadRecord(cur);
                if (record == null) continue;
                AccessStats access = cur.access();
                TierOutcome<PatternRecord> put = tiers.get(cur.tier()).put(record.withAccess(access));
                if (put.isFailure()) {
                    log.debug("Access statistics of {} not written back: {}", p.id(), put.detail());
                    continue;
                }
                long written = access.accessCount();
                directory.computeIfPresent(p.id(), (k, latest) ->
                        latest.sameRevision(cur) && latest.access().accessCount() == written
                                ? latest.withAccess(latest.access(), false) : latest);
            }
        }
    }

    private PatternRecord loadRecord(Placement p) {
        TierOutcome<PatternRecord> outcome = tiers.get(p.tier()).get(p.id());
        if (outcome.isOk()) return outcome.value();
        if (outcome.status() == TierOutcome.Status.NOT_FOUND) {
            tracer.onIntegrityEvent("placement " + p.id() + " has no record in " + p.tier());
            log.warn("Placement {} has no record in {}", p.id(), p.tier());
        } else {
            tracer.onTierDegraded(p.tier(), outcome.status());
        }
        return null;
    }

    private void deleteStaleCopy(String id, StorageTier tier) {
        TierOutcome<Boolean> removed = tiers.get(tier).delete(id);
        if (removed.isFailure()) {
            log.warn("Stale copy of {} left in {}: {}", id, tier, removed.detail());
        }
    }

    // ---------------------------------------------------------------- deduplication

    @Override
    public DeduplicationResult deduplicate() {
        ensureOpen();
        synchronized (maintenanceMonitor) {
            long now = clock.millis();
            Map<String, Placement> seen = new HashMap<>(directory);
            List<String> ids = new ArrayList<>(seen.keySet());
            Collections.sort(ids);
            Fetch fetched = fetch(ids, false);
            if (!fetched.failed().isEmpty()) {
                log.warn("Deduplicating without tiers {}", fetched.failed());
            }

            Deduplicator.Outcome outcome = deduplicator.deduplicate(
                    fetched.found().values().stream().map(PatternRecord::pattern).toList());
            List<Deduplicator.Merge> merges = outcome.merges();
            int batchSize = config.migrationBatchSize();
            int applied = 0;
            for (int from = 0; from < merges.size(); from += batchSize) {
                applied += applyMerges(merges.subList(from, Math.min(merges.size(), from + batchSize)), seen, now);
                Thread.yield();
            }

            DeduplicationResult result = outcome.result();
            if (applied != result.merged()) {
                log.debug("{} of {} merges skipped: patterns changed while deduplicating",
                        result.merged() - applied, result.merged());
                result = new DeduplicationResult(result.candidatesFound(), applied,
                        result.spaceSaved(), result.processingTimeMs());
            }
            dedupHistory.append(result);
            dedupRuns.incrementAndGet();
            if (result.merged() > 0) {
                materializer.invalidate(QueryMaterializer.Dependency.PATTERNS);
                materializer.invalidate(QueryMaterializer.Dependency.TIERS);
            }
            return result;
        }
    }

    /**
     * Writes merged records and removes the absorbed ones. A merge is skipped when any of its
     * patterns was replaced or moved after {@code seen} was taken.
     *
     * @return number of absorbed patterns actually removed
     */
    private int applyMerges(List<Deduplicator.Merge> batch, Map<String, Placement> seen, long now) {
        record Prepared(PatternRecord record, Placement previous, List<Placement> absorbed) {}

        List<String> ids = new ArrayList<>();
        for (Deduplicator.Merge m : batch) {
            ids.add(m.representativeId());
            ids.addAll(m.absorbedIds());
        }

        try (StripedLocks.Held ignored = placementLocks.lockAll(ids)) {
            List<Prepared> prepared = new ArrayList<>();
            for (Deduplicator.Merge m : batch) {
                Placement rep = directory.get(m.representativeId());
                if (rep == null || !rep.sameRevision(seen.get(rep.id()))) {
                    log.debug("Merge into {} skipped: representative changed", m.representativeId());
                    continue;
                }
                AccessStats access = rep.access();
                List<Placement> absorbed = new ArrayList<>();
                boolean changed = false;
                for (String absorbedId : m.absorbedIds()) {
                    Placement a = directory.get(absorbedId);
                    if (a == null) continue;
                    if (!a.sameRevision(seen.get(absorbedId))) {
                        changed = true;
                        break;
                    }
                    absorbed.add(a);
                    access = access.combine(a.access());
                }
                if (changed) {
                    log.debug("Merge into {} skipped: absorbed pattern changed", rep.id());
                    continue;
                }
                QualityTierRouter.Assignment assignment = router.assign(m.merged().profile(), access, now);
                PatternRecord record = new PatternRecord(m.merged(), assignment.tier(), access.withRelevance(assignment.score()));
                TierOutcome<PatternRecord> put = tiers.get(assignment.tier()).put(record);
                if (put.isFailure()) {
                    log.warn("Merge into {} skipped: {}", rep.id(), put.detail());
                    continue;
                }
                prepared.add(new Prepared(record, rep, absorbed));
            }

            try (AutoLock ignored2 = AutoLock.write(lock)) {
                for (Prepared p : prepared) {
                    String id = p.record().id();
                    directory.put(id, Placement.of(p.record(), now, revisions.incrementAndGet()));
                    if (p.record().tier().isQueryFacing()) {
                        index.insert(id, p.record().pattern().coordinate());
                    } else {
                        index.remove(id);
                    }
                    for (Placement a : p.absorbed()) {
                        directory.remove(a.id());
                        index.remove(a.id());
                    }
                }
            }

            int removed = 0;
            for (Prepared p : prepared) {
                String id = p.record().id();
                StorageTier tier = p.record().tier();
                if (p.previous().tier() != tier) {
                    deleteStaleCopy(id, p.previous().tier());
                    recordTransition(new MigrationRecord(id, p.previous().tier(), tier, p.previous().lastScore(),
                            p.record().access().relevance(), MigrationRecord.Reason.MERGE, now));
                }
                List<String> removedIds = new ArrayList<>();
                for (Placement a : p.absorbed()) {
                    deleteStaleCopy(a.id(), a.tier());
                    warmer.forget(a.id());
                    removedIds.add(a.id());
                }
                removed += removedIds.size();
                warmer.refresh(p.record().pattern());
                tracer.onMerged(id, removedIds);
            }
            return removed;
        }
    }

    // ---------------------------------------------------------------- warming

    @Override
    public WarmingStats warmCache() {
        ensureOpen();
        return warmer.warmCache(clock.millis(), this::loadPattern, this::promoteForWarming);
    }

    private Optional<Pattern> loadPattern(String id) {
        Placement p = directory.get(id);
        if (p == null) return Optional.empty();
        return Optional.ofNullable(loadRecord(p)).map(PatternRecord::pattern);
    }

    private boolean promoteForWarming(String id) {
        Placement p = directory.get(id);
        if (p == null || p.tier() == StorageTier.PREMIUM || !p.tier().isQueryFacing()) return false;
        long now = clock.millis();
        double score = router.scorer().score(p.profile(), p.access(), now);
        MigrationRecord transition = new MigrationRecord(id, p.tier(), StorageTier.PREMIUM,
                Double.isNaN(p.lastScore()) ? score : p.lastScore(), score, MigrationRecord.Reason.WARMING, now);
        boolean moved = !applyMoves(List.of(new Move(p, transition)), now).isEmpty();
        if (moved) materializer.invalidate(QueryMaterializer.Dependency.TIERS);
        return moved;
    }

    // ---------------------------------------------------------------- consistency

    @Override
    public ConsistencyReport checkConsistency(boolean repair) {
        ensureOpen();
        synchronized (maintenanceMonitor) {
            try (StripedLocks.Held held = placementLocks.lockEverything()) {
                TierScan scan = scanTiers();
                Map<String, PatternRecord> authoritative = scan.records();

                Set<String> indexOnly = new TreeSet<>();
                Set<String> tierOnly = new TreeSet<>();
                Set<String> misplaced = new TreeSet<>(scan.duplicated());
                List<String> violations;
                try (AutoLock ignored = AutoLock.read(lock)) {
                    violations = index.verifyStructure();
                    Set<String> indexed = index.ids();
                    for (String id : indexed) {
                        PatternRecord r = authoritative.get(id);
                        if (r == null || !r.tier().isQueryFacing()) indexOnly.add(id);
                    }
                    for (String id : directory.keySet()) {
                        if (!authoritative.containsKey(id)) indexOnly.add(id);
                    }
                    for (PatternRecord r : authoritative.values()) {
                        Placement p = directory.get(r.id());
                        if (p == null || (r.tier().isQueryFacing() && !indexed.contains(r.id()))) {
                            tierOnly.add(r.id());
                        } else if (p.tier() != r.tier()) {
                            misplaced.add(r.id());
                        }
                    }
                }

                boolean consistent = indexOnly.isEmpty() && tierOnly.isEmpty() && misplaced.isEmpty() && violations.isEmpty();
                if (!repair || consistent) {
                    return new ConsistencyReport(indexOnly, tierOnly, misplaced, violations, false);
                }

                rebuild(authoritative.values());
                for (PatternRecord stale : scan.staleCopies()) deleteStaleCopy(stale.id(), stale.tier());
                ConsistencyReport report = new ConsistencyReport(indexOnly, tierOnly, misplaced, violations, true);
                log.warn("Rebuilt placement directory and index from tier scan: {}", report);
                return report;
            }
        }
    }

    /**
     * Fails with {@link IndexInconsistencyException} if the index, the directory and the tiers
     * disagree. Nothing is repaired.
     */
    public ConsistencyReport requireConsistent() {
        ConsistencyReport report = checkConsistency(false);
        if (!report.isConsistent()) {
            throw new IndexInconsistencyException("Index and tiers disagree", report);
        }
        return report;
    }

    private TierScan scanTiers() {
        Map<String, PatternRecord> records = new HashMap<>();
        Set<String> duplicated = new HashSet<>();
        List<PatternRecord> stale = new ArrayList<>();
        for (StorageTier tier : StorageTier.values()) {
            TierOutcome<List<PatternRecord>> scan = tiers.get(tier).scan(r -> true);
            if (scan.isFailure()) {
                throw new TierUnavailableException(tier, "tier scan failed: " + scan.detail());
            }
            for (PatternRecord r : scan.value()) {
                PatternRecord held = r.tier() == tier ? r : r.withTier(tier);
                PatternRecord prior = records.get(held.id());
                if (prior == null) {
                    records.put(held.id(), held);
                    continue;
                }
                duplicated.add(held.id());
                if (held.access().accessCount() > prior.access().accessCount()) {
                    records.put(held.id(), held);
                    stale.add(prior);
                } else {
                    stale.add(held);
                }
            }
        }
        return new TierScan(records, duplicated, stale);
    }

    private void rebuild(Collection<PatternRecord> records) {
        Map<String, Coordinate> points = new HashMap<>();
        try (AutoLock ignored = AutoLock.write(lock)) {
            Map<String, Placement> previous = new HashMap<>(directory);
            directory.clear();
            index.clear();
            for (PatternRecord r : records) {
                Placement placement = Placement.of(r, 0L, revisions.incrementAndGet());
                Placement old = previous.get(r.id());
                if (old != null && old.tier() == r.tier() && old.access().accessCount() > r.access().accessCount()) {
                    placement = placement.withAccess(old.access(), true);
                }
                directory.put(r.id(), placement);
                if (r.tier().isQueryFacing()) points.put(r.id(), placement.coordinate());
            }
            index.bulkLoad(points);
        }
        warmer.invalidateAll();
        materializer.invalidateAll();
    }

    // ---------------------------------------------------------------- aggregates and stats

    @Override
    public Map<String, Number> aggregate(AggregateQuery query) {
        ensureOpen();
        Objects.requireNonNull(query, "query");
        return materializer.getOrCompute(query, () -> computeAggregate(query));
    }

    private Map<String, Number> computeAggregate(AggregateQuery query) {
        Map<String, Number> result;
        switch (query) {
            case CATEGORY_DISTRIBUTION -> {
                Map<String, Number> counts = new TreeMap<>();
                for (Placement p : directory.values()) {
                    if (p.tier().isQueryFacing()) counts.merge(p.profile().category().name(), 1L, (a, b) -> a.longValue() + b.longValue());
                }
                result = counts;
            }
            case TIER_DISTRIBUTION -> {
                Map<String, Number> counts = new LinkedHashMap<>();
                for (StorageTier tier : StorageTier.values()) counts.put(tier.name(), 0L);
                for (Placement p : directory.values()) counts.merge(p.tier().name(), 1L, (a, b) -> a.longValue() + b.longValue());
                result = counts;
            }
            case COMPLEXITY_HOTSPOTS -> {
                Map<String, Double> byFile = new HashMap<>();
                for (Pattern p : queryFacingPatterns()) {
                    for (String file : filesOf(p)) byFile.merge(file, p.profile().complexity(), Double::sum);
                }
                result = ranked(byFile);
            }
            case CROSS_CUTTING -> {
                Map<String, Double> spread = new HashMap<>();
                for (Pattern p : queryFacingPatterns()) {
                    Set<String> files = filesOf(p);
                    if (files.size() >= AggregateQuery.CROSS_CUTTING_MIN_FILES) spread.put(p.id(), (double) files.size());
                }
                Map<String, Number> counts = new LinkedHashMap<>();
                ranked(spread).forEach((id, n) -> counts.put(id, n.longValue()));
                result = counts;
            }
            default -> throw new IllegalStateException("Unhandled aggregate " + query);
        }
        return Collections.unmodifiableMap(result);
    }

    private List<Pattern> queryFacingPatterns() {
        List<String> ids = directory.values().stream()
                .filter(p -> p.tier().isQueryFacing())
                .map(Placement::id)
                .sorted()
                .toList();
        Fetch fetched = fetch(ids, true);
        if (fetched.exhausted()) throw new TierExhaustedException(fetched.failed());
        if (!fetched.failed().isEmpty()) log.warn("Aggregate computed without tiers {}", fetched.failed());
        return fetched.found().values().stream().map(PatternRecord::pattern).toList();
    }

    private static Set<String> filesOf(Pattern p) {
        Set<String> files = new TreeSet<>();
        for (CodeLocation loc : p.locations()) files.add(loc.file());
        return files;
    }

    private static Map<String, Number> ranked(Map<String, Double> values) {
        Map<String, Number> out = new LinkedHashMap<>();
        values.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .forEach(e -> out.put(e.getKey(), e.getValue()));
        return out;
    }

    @Override
    public EngineStats stats() {
        ensureOpen();
        Map<StorageTier, Integer> counts = new EnumMap<>(StorageTier.class);
        for (StorageTier tier : StorageTier.values()) counts.put(tier, 0);
        for (Placement p : directory.values()) counts.merge(p.tier(), 1, Integer::sum);
        return new EngineStats(counts, index.stats(), warmer.getStats(), materializer.getStats(),
                router.promotedTotal() + router.demotedTotal(), router.cycles(), dedupRuns.get(), pendingWrites.size());
    }

    @Override
    public List<MigrationRecord> migrationHistory() {
        return router.history();
    }

    @Override
    public List<DeduplicationResult> deduplicationHistory() {
        return dedupHistory.snapshot();
    }

    @Override
    public QuerySession openSession() {
        ensureOpen();
        return new QuerySession(intent -> fieldEngine.generateField(intent, contextTracker.snapshot()),
                fieldEngine::morphField, this::execute, clock);
    }

    // ---------------------------------------------------------------- lifecycle

    private void scheduleMaintenance() {
        schedule("migration", config.migrationInterval(), this::migrate);
        schedule("cache warming", config.warmInterval(), this::warmCache);
        schedule("pending-write retry", config.retryInterval(), this::retryPendingWrites);
        schedule("consistency scan", config.consistencyInterval(), () -> checkConsistency(true));
    }

    private void schedule(String name, Duration interval, Runnable task) {
        long millis = interval.toMillis();
        if (millis <= 0) return;
        scheduler.scheduleWithFixedDelay(() -> {
            try {
                task.run();
            } catch (EngineClosedException e) {
                log.debug("Skipped {}: engine closed", name);
            } catch (RuntimeException e) {
                log.warn("Background {} failed", name, e);
            }
        }, millis, millis, TimeUnit.MILLISECONDS);
        log.debug("Scheduled {} every {} ms", name, millis);
    }

    private void ensureOpen() {
        if (closed.get()) throw new EngineClosedException();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        shutdown(scheduler, 5);
        try {
            writeBackAccess(directory.values().stream().filter(Placement::dirty).toList());
        } catch (RuntimeException e) {
            log.warn("Failed to flush access statistics on close: {}", e.toString());
        }
        shutdown(ioExecutor, 30);
        warmer.invalidateAll();
        materializer.invalidateAll();
        if (!pendingWrites.isEmpty()) {
            log.warn("Closing with {} queued writes that never reached their tier", pendingWrites.size());
        }
        log.info("Pattern memory closed ({} placements)", directory.size());
    }

    private void shutdownExecutors() {
        shutdown(scheduler, 5);
        shutdown(ioExecutor, 30);
    }

    private static void shutdown(ExecutorService executor, long seconds) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(seconds, TimeUnit.SECONDS)) executor.shutdownNow();
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
