package org.iceforge.governor.config;

import org.iceforge.governor.cache.CacheStore;
import org.iceforge.governor.metrics.GovernanceMetricsRegistry;
import org.iceforge.governor.query.CacheFacade;
import org.iceforge.governor.quota.QuotaLedger;
import org.iceforge.governor.registry.ArtifactRegistry;
import org.iceforge.governor.registry.InMemoryArtifactRegistry;
import org.iceforge.governor.registry.InMemoryJobRegistry;
import org.iceforge.governor.registry.JobAdmission;
import org.iceforge.governor.registry.JobRegistry;
import org.iceforge.governor.retention.RetentionPruner;
import org.iceforge.governor.retention.RetentionScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class GovernorConfig {
    private static final Logger log = LoggerFactory.getLogger(GovernorConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CacheStore cacheStore(CacheProperties props, Clock clock, GovernanceMetricsRegistry metrics) {
        return new CacheStore(props.getMaxEntries(), props.maxBytesValue(), clock, metrics);
    }

    @Bean
    public QuotaLedger quotaLedger(QuotaProperties props, Clock clock, GovernanceMetricsRegistry metrics) {
        QuotaLedger ledger = new QuotaLedger(props.toTiers(), props.effectiveDefaultTier(), clock, metrics);
        props.getTenants().forEach(ledger::assignTier);
        if (!props.getTenants().isEmpty()) {
            log.info("Assigned {} tenants to configured tiers", props.getTenants().size());
        }
        return ledger;
    }

    @Bean
    public ExecutorService computeExecutor(CacheProperties props) {
        int threads = Math.max(1, props.getComputeThreads());
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "governor-compute");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public CacheFacade cacheFacade(CacheStore store, QuotaLedger ledger, ExecutorService computeExecutor, CacheProperties props) {
        return new CacheFacade(store, ledger, computeExecutor, props.toFacadeOptions());
    }

    @Bean
    public JobRegistry jobRegistry() {
        return new InMemoryJobRegistry();
    }

    @Bean
    @ConditionalOnProperty(prefix = "governor.registry", name = "store", havingValue = "local", matchIfMissing = true)
    public ArtifactRegistry localArtifactRegistry() {
        log.info("Using in-memory artifact registry");
        return new InMemoryArtifactRegistry();
    }

    @Bean
    public JobAdmission jobAdmission(QuotaLedger ledger, JobRegistry jobs, ArtifactRegistry artifacts) {
        return new JobAdmission(ledger, jobs, artifacts);
    }

    @Bean
    public RetentionPruner retentionPruner(JobRegistry jobs, ArtifactRegistry artifacts, QuotaLedger ledger,
                                           CacheStore cache, Clock clock, GovernanceMetricsRegistry metrics) {
        return new RetentionPruner(jobs, artifacts, ledger, cache, clock, metrics);
    }

    @Bean
    public RetentionScheduler retentionScheduler(RetentionPruner pruner, PruneProperties props, Clock clock) {
        return new RetentionScheduler(pruner, props.toConfig(), clock);
    }
}
