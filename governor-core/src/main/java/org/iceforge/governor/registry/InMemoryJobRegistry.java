package org.iceforge.governor.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryJobRegistry implements JobRegistry {
    private static final Logger log = LoggerFactory.getLogger(InMemoryJobRegistry.class);

    private final ConcurrentHashMap<String, JobRecord> jobs = new ConcurrentHashMap<>();

    @Override
    public void register(JobRecord job) {
        Objects.requireNonNull(job, "job");
        jobs.put(job.jobId(), job);
        log.debug("Registered job {} for tenant {}", job.jobId(), job.tenantId());
    }

    @Override
    public Optional<JobRecord> find(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public List<JobRecord> findCreatedBefore(Instant cutoff) {
        return jobs.values().stream()
                .filter(j -> j.createdAt().isBefore(cutoff))
                .sorted(RegistryOrdering.JOBS_OLDEST_FIRST)
                .toList();
    }

    @Override
    public boolean delete(String jobId) {
        return jobs.remove(jobId) != null;
    }

    @Override
    public int size() {
        return jobs.size();
    }
}
