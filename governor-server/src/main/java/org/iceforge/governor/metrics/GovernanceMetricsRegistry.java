package org.iceforge.governor.metrics;

import org.iceforge.governor.cache.RemovalCause;
import org.iceforge.governor.events.GovernanceEventListener;
import org.iceforge.governor.quota.QuotaDecision;
import org.iceforge.governor.quota.ResourceType;
import org.iceforge.governor.retention.PruneStats;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-memory governance counters for the metrics endpoint. Fed by the cache, the quota ledger and
 * the retention pruner through {@link GovernanceEventListener}.
 */
@Component
public class GovernanceMetricsRegistry implements GovernanceEventListener {
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final Map<RemovalCause, LongAdder> removals = new EnumMap<>(RemovalCause.class);
    private final Map<ResourceType, LongAdder> denials = new EnumMap<>(ResourceType.class);
    private final LongAdder pruneCycles = new LongAdder();
    private final LongAdder pruneErrors = new LongAdder();
    private final LongAdder jobsPruned = new LongAdder();
    private final LongAdder artifactsPruned = new LongAdder();
    private final LongAdder bytesFreed = new LongAdder();

    public GovernanceMetricsRegistry() {
        for (RemovalCause c : RemovalCause.values()) removals.put(c, new LongAdder());
        for (ResourceType r : ResourceType.values()) denials.put(r, new LongAdder());
    }

    @Override
    public void cacheHit(String key) { hits.increment(); }

    @Override
    public void cacheMiss(String key) { misses.increment(); }

    @Override
    public void cacheEviction(String key, RemovalCause cause) {
        removals.get(cause).increment();
    }

    @Override
    public void quotaDenied(QuotaDecision decision) {
        denials.get(decision.resource()).increment();
    }

    @Override
    public void pruneCompleted(PruneStats stats) {
        pruneCycles.increment();
        pruneErrors.add(stats.errors().size());
        jobsPruned.add(stats.jobsDeleted());
        artifactsPruned.add(stats.artifactsDeleted());
        bytesFreed.add(stats.bytesFreed());
    }

    public long hits() { return hits.sum(); }
    public long misses() { return misses.sum(); }
    public long evictions(RemovalCause cause) { return removals.get(cause).sum(); }
    public long denials(ResourceType resource) { return denials.get(resource).sum(); }
    public long pruneCycles() { return pruneCycles.sum(); }
    public long bytesFreed() { return bytesFreed.sum(); }

    public Map<String, Object> snapshot() {
        Map<String, Object> cache = new LinkedHashMap<>();
        cache.put("hits", hits.sum());
        cache.put("misses", misses.sum());
        cache.put("evicted", removals.get(RemovalCause.EVICTED).sum());
        cache.put("expired", removals.get(RemovalCause.EXPIRED).sum());

        Map<String, Long> denied = new LinkedHashMap<>();
        denials.forEach((r, n) -> denied.put(r.propertyName(), n.sum()));

        Map<String, Object> prune = new LinkedHashMap<>();
        prune.put("cycles", pruneCycles.sum());
        prune.put("errors", pruneErrors.sum());
        prune.put("jobsDeleted", jobsPruned.sum());
        prune.put("artifactsDeleted", artifactsPruned.sum());
        prune.put("bytesFreed", bytesFreed.sum());

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("cache", cache);
        out.put("quotaDenials", denied);
        out.put("prune", prune);
        return out;
    }
}
