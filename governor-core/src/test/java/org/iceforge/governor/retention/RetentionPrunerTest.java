// java
package org.iceforge.governor.retention;

import org.iceforge.governor.cache.CacheKeys;
import org.iceforge.governor.cache.CacheStore;
import org.iceforge.governor.events.GovernanceEventListener;
import org.iceforge.governor.quota.QuotaLedger;
import org.iceforge.governor.quota.ResourceType;
import org.iceforge.governor.registry.ArtifactRecord;
import org.iceforge.governor.registry.InMemoryArtifactRegistry;
import org.iceforge.governor.registry.InMemoryJobRegistry;
import org.iceforge.governor.registry.JobRecord;
import org.iceforge.governor.registry.JobStatus;
import org.iceforge.governor.registry.RegistryException;
import org.iceforge.governor.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetentionPrunerTest {

    private MutableClock clock;
    private InMemoryJobRegistry jobs;
    private InMemoryArtifactRegistry artifacts;
    private QuotaLedger ledger;
    private CacheStore cache;
    private List<PruneStats> completed;
    private RetentionPruner pruner;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T00:00:00Z");
        jobs = new InMemoryJobRegistry();
        artifacts = new InMemoryArtifactRegistry();
        ledger = new QuotaLedger();
        cache = new CacheStore(100, 1 << 20, clock, GovernanceEventListener.NOOP);
        completed = new ArrayList<>();
        GovernanceEventListener listener = new GovernanceEventListener() {
            @Override
            public void pruneCompleted(PruneStats stats) {
                completed.add(stats);
            }
        };
        pruner = new RetentionPruner(jobs, artifacts, ledger, cache, clock, listener);
    }

    private Instant daysAgo(int days) {
        return clock.instant().minus(Duration.ofDays(days));
    }

    private void addArtifact(String id, String tenant, String jobId, Instant createdAt, long size) {
        artifacts.register(new ArtifactRecord(id, tenant, jobId, createdAt, size));
        ledger.reserve(tenant, ResourceType.ARTIFACTS, size);
    }

    private void addJob(String id, String tenant, Instant createdAt, JobStatus status, List<String> artifactIds) {
        jobs.register(new JobRecord(id, tenant, createdAt, status, artifactIds));
        ledger.reserve(tenant, ResourceType.JOBS, 1);
    }

    @Test
    void runCycle_deletesOldJobsWithTheirArtifacts() {
        addArtifact("a1", "t1", "j1", daysAgo(40), 100);
        addArtifact("a2", "t1", "j1", daysAgo(40), 50);
        addJob("j1", "t1", daysAgo(40), JobStatus.SUCCEEDED, List.of("a1", "a2"));
        addJob("j2", "t1", daysAgo(1), JobStatus.SUCCEEDED, List.of());
        cache.put(CacheKeys.forArtifact("a1", "preview"), new byte[10], null);

        PruneStats stats = pruner.runCycle(PruneConfig.defaults(), () -> false);

        assertEquals(1, stats.jobsDeleted());
        assertEquals(2, stats.artifactsDeleted());
        assertEquals(150L, stats.bytesFreed());
        assertTrue(stats.errors().isEmpty());
        assertFalse(stats.aborted());
        assertTrue(jobs.find("j1").isEmpty());
        assertTrue(jobs.find("j2").isPresent());
        assertEquals(0, artifacts.size());
        assertEquals(1L, ledger.usage("t1").get(ResourceType.JOBS));
        assertEquals(0L, ledger.usage("t1").get(ResourceType.ARTIFACTS));
        assertEquals(0, cache.size());
        assertEquals(List.of(stats), completed);
    }

    @Test
    void runCycle_skipsJobsStillRunning() {
        addJob("j1", "t1", daysAgo(40), JobStatus.RUNNING, List.of());
        PruneStats stats = pruner.runCycle(PruneConfig.defaults(), () -> false);
        assertEquals(0, stats.jobsMatched());
        assertTrue(jobs.find("j1").isPresent());
    }

    @Test
    void runCycle_isIdempotentOnUnchangedData() {
        addArtifact("a1", "t1", null, daysAgo(31), 10);
        addArtifact("a2", "t1", null, daysAgo(29), 10);

        PruneStats first = pruner.runCycle(PruneConfig.defaults(), () -> false);
        PruneStats second = pruner.runCycle(PruneConfig.defaults(), () -> false);

        assertEquals(1, first.artifactsDeleted());
        assertEquals(0, second.artifactsMatched());
        assertEquals(0, second.artifactsDeleted());
        assertTrue(artifacts.find("a2").isPresent());
    }

    @Test
    void dryRun_reportsMatchesButDeletesNothing() {
        addArtifact("a1", "t1", null, daysAgo(31), 10);
        addArtifact("a2", "t1", null, daysAgo(32), 20);
        addArtifact("a3", "t2", null, daysAgo(90), 30);
        cache.put("k", new byte[1], Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(5));

        PruneStats stats = pruner.runCycle(PruneConfig.defaults().withDryRun(true), () -> false);

        assertTrue(stats.dryRun());
        assertEquals(3, stats.artifactsMatched());
        assertEquals(60L, stats.bytesMatched());
        assertEquals(0, stats.artifactsDeleted());
        assertEquals(0, stats.cacheEntriesExpired());
        assertEquals(3, artifacts.size());
        assertEquals(30L, ledger.usage("t1").get(ResourceType.ARTIFACTS));
    }

    @Test
    void runCycle_trimsTenantsAboveArtifactCapOldestFirst() {
        for (int i = 0; i < 5; i++) {
            addArtifact("a" + i, "t1", null, daysAgo(10 - i), 1);
        }
        addArtifact("b0", "t2", null, daysAgo(5), 1);
        PruneConfig config = new PruneConfig(true, Duration.ofHours(1), Duration.ofDays(30), Duration.ofDays(30),
                3, 100, false, 20, Duration.ofSeconds(1));

        PruneStats stats = pruner.runCycle(config, () -> false);

        assertEquals(2, stats.artifactsDeleted());
        assertTrue(artifacts.find("a0").isEmpty());
        assertTrue(artifacts.find("a1").isEmpty());
        assertEquals(3, artifacts.findByTenant("t1").size());
        assertTrue(artifacts.find("b0").isPresent());
    }

    @Test
    void runCycle_recordsFailuresAndContinues() {
        InMemoryArtifactRegistry flaky = new InMemoryArtifactRegistry() {
            @Override
            public boolean delete(String artifactId) {
                if (artifactId.equals("bad")) throw new RegistryException("storage offline");
                return super.delete(artifactId);
            }
        };
        pruner = new RetentionPruner(jobs, flaky, ledger, cache, clock, GovernanceEventListener.NOOP);
        flaky.register(new ArtifactRecord("bad", "t1", null, daysAgo(40), 5));
        flaky.register(new ArtifactRecord("good", "t1", null, daysAgo(40), 5));
        ledger.reserve("t1", ResourceType.ARTIFACTS, 10);

        PruneStats stats = pruner.runCycle(PruneConfig.defaults(), () -> false);

        assertEquals(1, stats.artifactsDeleted());
        assertEquals(List.of("Failed to delete artifact bad: storage offline"), stats.errors());
        assertTrue(flaky.find("bad").isPresent());
        assertEquals(5L, ledger.usage("t1").get(ResourceType.ARTIFACTS));
    }

    @Test
    void runCycle_stopsBetweenBatchesWhenCancelled() {
        for (int i = 0; i < 5; i++) {
            addArtifact("a" + i, "t1", null, daysAgo(40), 1);
        }
        PruneConfig config = new PruneConfig(true, Duration.ofHours(1), Duration.ofDays(30), Duration.ofDays(30),
                1000, 2, false, 20, Duration.ofSeconds(1));
        AtomicInteger polls = new AtomicInteger();

        PruneStats stats = pruner.runCycle(config, () -> polls.incrementAndGet() > 1);

        assertTrue(stats.aborted());
        assertEquals(5, stats.artifactsMatched());
        assertEquals(2, stats.artifactsDeleted());
        assertEquals(3, artifacts.size());
    }

    @Test
    void runCycle_batchSizeBoundsDeletionsInsideOneJob() {
        addArtifact("a1", "t1", "j1", daysAgo(40), 100);
        addArtifact("a2", "t1", "j1", daysAgo(40), 50);
        addJob("j1", "t1", daysAgo(40), JobStatus.SUCCEEDED, List.of("a1", "a2"));
        PruneConfig config = new PruneConfig(true, Duration.ofHours(1), Duration.ofDays(30), Duration.ofDays(30),
                1000, 1, false, 20, Duration.ofSeconds(1));
        AtomicInteger polls = new AtomicInteger();

        PruneStats stats = pruner.runCycle(config, () -> polls.incrementAndGet() > 1);

        assertTrue(stats.aborted());
        assertEquals(1, stats.artifactsDeleted());
        assertEquals(0, stats.jobsDeleted());
        assertFalse(artifacts.find("a1").isPresent());
        assertTrue(artifacts.find("a2").isPresent());
        assertTrue(jobs.find("j1").isPresent());
        assertEquals(50L, ledger.usage("t1").get(ResourceType.ARTIFACTS));
        assertEquals(1L, ledger.usage("t1").get(ResourceType.JOBS));

        PruneStats rest = pruner.runCycle(PruneConfig.defaults(), () -> false);

        assertEquals(1, rest.artifactsDeleted());
        assertEquals(1, rest.jobsDeleted());
        assertEquals(0, artifacts.size());
        assertEquals(0, jobs.size());
    }

    @Test
    void runCycle_purgesExpiredCacheEntries() {
        cache.put("k1", new byte[1], Duration.ofSeconds(1));
        cache.put("k2", new byte[1], null);
        clock.advance(Duration.ofSeconds(2));

        PruneStats stats = pruner.runCycle(PruneConfig.defaults(), () -> false);

        assertEquals(1, stats.cacheEntriesExpired());
        assertEquals(1, cache.size());
    }

    @Test
    void pruneConfig_validateRejectsBadValues() {
        PruneConfig d = PruneConfig.defaults();
        assertThrows(IllegalArgumentException.class, () -> new PruneConfig(true, Duration.ZERO, d.maxJobAge(),
                d.maxArtifactAge(), 1, 1, false, 1, Duration.ZERO).validate());
        assertThrows(IllegalArgumentException.class, () -> new PruneConfig(true, d.interval(), d.maxJobAge(),
                d.maxArtifactAge(), -1, 1, false, 1, Duration.ZERO).validate());
        assertThrows(IllegalArgumentException.class, () -> new PruneConfig(true, d.interval(), d.maxJobAge(),
                d.maxArtifactAge(), 1, 0, false, 1, Duration.ZERO).validate());
        assertThrows(IllegalArgumentException.class, () -> new PruneConfig(true, d.interval(), Duration.ofDays(-1),
                d.maxArtifactAge(), 1, 1, false, 1, Duration.ZERO).validate());
        assertSame(d, d.validate());
    }

    @Test
    void pruneStats_reportsFreedMegabytes() {
        PruneStats stats = PruneStats.builder(clock.instant()).artifactDeleted(3L * 1024 * 1024).build();
        assertEquals(3.0d, stats.bytesFreedMb(), 0.0001d);
    }
}
