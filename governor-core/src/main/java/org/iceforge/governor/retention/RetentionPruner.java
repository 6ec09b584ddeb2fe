package org.iceforge.governor.retention;

import org.iceforge.governor.cache.CacheStore;
import org.iceforge.governor.events.GovernanceEventListener;
import org.iceforge.governor.events.GovernanceEvents;
import org.iceforge.governor.quota.QuotaLedger;
import org.iceforge.governor.quota.ResourceType;
import org.iceforge.governor.registry.ArtifactRecord;
import org.iceforge.governor.registry.ArtifactRegistry;
import org.iceforge.governor.registry.JobRecord;
import org.iceforge.governor.registry.JobRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * One retention cycle: expire cache entries, pick jobs and artifacts past their retention, delete
 * them and give their usage back to the quota ledger.
 * <p>
 * A failed deletion is recorded in {@link PruneStats#errors()} and the cycle moves on. Deleted
 * items are gone from the registries, so running the cycle again on unchanged data deletes nothing.
 */
public class RetentionPruner {
    private static final Logger log = LoggerFactory.getLogger(RetentionPruner.class);

    private final JobRegistry jobs;
    private final ArtifactRegistry artifacts;
    private final QuotaLedger ledger;
    private final CacheStore cache;
    private final Clock clock;
    private final GovernanceEventListener events;

    private record Candidates(Map<JobRecord, List<ArtifactRecord>> jobs, List<ArtifactRecord> artifacts) {}

    public RetentionPruner(JobRegistry jobs, ArtifactRegistry artifacts, QuotaLedger ledger, CacheStore cache,
                           Clock clock, GovernanceEventListener events) {
        this.jobs = Objects.requireNonNull(jobs, "jobs");
        this.artifacts = Objects.requireNonNull(artifacts, "artifacts");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.events = events == null ? GovernanceEventListener.NOOP : events;
    }

    /**
     * @param cancelled polled between batches; once true the remaining work is skipped and the
     *                  result is marked aborted
     * @throws RetentionException if the candidates cannot be listed
     */
    public PruneStats runCycle(PruneConfig config, BooleanSupplier cancelled) {
        Objects.requireNonNull(config, "config");
        BooleanSupplier stop = cancelled == null ? () -> false : cancelled;
        Instant started = clock.instant();
        PruneStats.Builder stats = PruneStats.builder(started).dryRun(config.dryRun());

        if (!config.dryRun()) {
            stats.cacheEntriesExpired(cache.purgeExpired());
        }

        Candidates candidates;
        try {
            candidates = findCandidates(config, started);
        } catch (RuntimeException e) {
            throw new RetentionException("Failed to list retention candidates", e);
        }
        candidates.jobs().forEach((job, owned) -> {
            stats.jobMatched();
            owned.forEach(a -> stats.artifactMatched(a.sizeBytes()));
        });
        candidates.artifacts().forEach(a -> stats.artifactMatched(a.sizeBytes()));

        if (config.dryRun()) {
            candidates.jobs().forEach((job, owned) -> log.info("[dry-run] Would delete job {} (tenant={}, created={}, artifacts={})",
                    job.jobId(), job.tenantId(), job.createdAt(), owned.size()));
            candidates.artifacts().forEach(a -> log.info("[dry-run] Would delete artifact {} (tenant={}, created={}, bytes={})",
                    a.artifactId(), a.tenantId(), a.createdAt(), a.sizeBytes()));
        } else {
            List<Runnable> tasks = new ArrayList<>();
            // one task per record so a batch bounds deletions, not jobs; a job goes after its artifacts
            candidates.jobs().forEach((job, owned) -> {
                owned.forEach(a -> tasks.add(() -> deleteArtifact(a, stats)));
                tasks.add(() -> deleteJob(job, stats));
            });
            candidates.artifacts().forEach(a -> tasks.add(() -> deleteArtifact(a, stats)));
            runInBatches(tasks, config.batchSize(), stop, stats);
        }

        PruneStats result = stats.duration(Duration.between(started, clock.instant())).build();
        log.info("Retention cycle finished: jobsDeleted={} artifactsDeleted={} freed={} MB matched={}/{} expiredCacheEntries={} errors={} dryRun={} aborted={}",
                result.jobsDeleted(), result.artifactsDeleted(), String.format("%.2f", result.bytesFreedMb()),
                result.jobsMatched(), result.artifactsMatched(), result.cacheEntriesExpired(), result.errors().size(),
                result.dryRun(), result.aborted());
        GovernanceEvents.publish(events, l -> l.pruneCompleted(result));
        return result;
    }

    private Candidates findCandidates(PruneConfig config, Instant now) {
        Map<JobRecord, List<ArtifactRecord>> jobCandidates = new LinkedHashMap<>();
        Set<String> claimed = new HashSet<>();
        for (JobRecord job : jobs.findCreatedBefore(now.minus(config.maxJobAge()))) {
            if (!job.status().isTerminal()) continue;
            List<ArtifactRecord> owned = new ArrayList<>();
            for (String id : job.artifactIds()) {
                Optional<ArtifactRecord> a = artifacts.find(id);
                if (a.isPresent() && claimed.add(id)) owned.add(a.get());
            }
            jobCandidates.put(job, owned);
        }

        List<ArtifactRecord> artifactCandidates = new ArrayList<>();
        for (ArtifactRecord a : artifacts.findCreatedBefore(now.minus(config.maxArtifactAge()))) {
            if (claimed.add(a.artifactId())) artifactCandidates.add(a);
        }

        int cap = config.maxArtifactsPerTenant();
        if (cap > 0) {
            for (String tenant : artifacts.tenants()) {
                List<ArtifactRecord> survivors = artifacts.findByTenant(tenant).stream()
                        .filter(a -> !claimed.contains(a.artifactId()))
                        .toList();
                int excess = survivors.size() - cap;
                if (excess <= 0) continue;
                log.info("Tenant {} holds {} artifacts, {} over the cap of {}", tenant, survivors.size(), excess, cap);
                for (ArtifactRecord a : survivors.subList(0, excess)) {
                    claimed.add(a.artifactId());
                    artifactCandidates.add(a);
                }
            }
        }
        return new Candidates(jobCandidates, artifactCandidates);
    }

    private static void runInBatches(List<Runnable> tasks, int batchSize, BooleanSupplier cancelled, PruneStats.Builder stats) {
        for (int from = 0; from < tasks.size(); from += batchSize) {
            if (cancelled.getAsBoolean()) {
                log.warn("Retention cycle cancelled with {} of {} deletions remaining", tasks.size() - from, tasks.size());
                stats.aborted(true);
                return;
            }
            for (Runnable task : tasks.subList(from, Math.min(tasks.size(), from + batchSize))) {
                task.run();
            }
        }
    }

    private void deleteJob(JobRecord job, PruneStats.Builder stats) {
        try {
            if (jobs.delete(job.jobId())) {
                ledger.release(job.tenantId(), ResourceType.JOBS, 1);
                stats.jobDeleted();
                log.debug("Deleted job {} (tenant={})", job.jobId(), job.tenantId());
            }
        } catch (RuntimeException e) {
            String msg = "Failed to delete job " + job.jobId() + ": " + e.getMessage();
            log.warn(msg, e);
            stats.error(msg);
        }
    }

    private void deleteArtifact(ArtifactRecord a, PruneStats.Builder stats) {
        try {
            if (artifacts.delete(a.artifactId())) {
                ledger.release(a.tenantId(), ResourceType.ARTIFACTS, a.sizeBytes());
                cache.invalidatePrefix(a.cacheKeyPrefix());
                stats.artifactDeleted(a.sizeBytes());
                log.debug("Deleted artifact {} (tenant={}, bytes={})", a.artifactId(), a.tenantId(), a.sizeBytes());
            }
        } catch (RuntimeException e) {
            String msg = "Failed to delete artifact " + a.artifactId() + ": " + e.getMessage();
            log.warn(msg, e);
            stats.error(msg);
        }
    }
}
