package org.iceforge.governor.registry;

import org.iceforge.governor.quota.QuotaDecision;
import org.iceforge.governor.quota.QuotaLedger;
import org.iceforge.governor.quota.ResourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Job submission path: charges the tenant's job and artifact quotas, then records the job and its
 * artifacts. Either both reservations and the records hold or none of them do.
 * <p>
 * The per-tenant artifact count cap is not checked here; the retention cycle trims tenants above it.
 */
public class JobAdmission {
    private static final Logger log = LoggerFactory.getLogger(JobAdmission.class);

    private final QuotaLedger ledger;
    private final JobRegistry jobs;
    private final ArtifactRegistry artifacts;

    public JobAdmission(QuotaLedger ledger, JobRegistry jobs, ArtifactRegistry artifacts) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.jobs = Objects.requireNonNull(jobs, "jobs");
        this.artifacts = Objects.requireNonNull(artifacts, "artifacts");
    }

    /**
     * Submissions are serialized so the duplicate checks and the registrations they guard see the
     * same registry state. A registration failure releases both reservations and drops whatever this
     * call already registered before the exception propagates.
     *
     * @return the first denial, or the artifact-bytes decision when admitted
     * @throws IllegalArgumentException if an artifact belongs to another tenant or job
     * @throws DuplicateRecordException if the job id, or an artifact id owned by a registered job, is
     *                                  already taken
     */
    public synchronized QuotaDecision submit(JobRecord job, List<ArtifactRecord> jobArtifacts) {
        Objects.requireNonNull(job, "job");
        List<ArtifactRecord> outputs = jobArtifacts == null ? List.of() : jobArtifacts;
        long bytes = 0L;
        Set<String> seen = new HashSet<>();
        for (ArtifactRecord a : outputs) {
            if (!a.tenantId().equals(job.tenantId())) {
                throw new IllegalArgumentException("Artifact " + a.artifactId() + " belongs to tenant " + a.tenantId()
                        + ", not " + job.tenantId());
            }
            if (a.jobId() != null && !a.jobId().equals(job.jobId())) {
                throw new IllegalArgumentException("Artifact " + a.artifactId() + " belongs to job " + a.jobId());
            }
            if (!seen.add(a.artifactId())) {
                throw new IllegalArgumentException("Artifact " + a.artifactId() + " is listed twice");
            }
            bytes = Math.addExact(bytes, a.sizeBytes());
        }
        if (jobs.find(job.jobId()).isPresent()) {
            throw new DuplicateRecordException("Job " + job.jobId() + " is already registered");
        }
        for (ArtifactRecord a : outputs) {
            Optional<ArtifactRecord> existing = artifacts.find(a.artifactId());
            // an artifact store may hold the object before admission; only a registered owner makes it taken
            if (existing.isPresent() && existing.get().jobId() != null && jobs.find(existing.get().jobId()).isPresent()) {
                throw new DuplicateRecordException("Artifact " + a.artifactId() + " is already owned by job "
                        + existing.get().jobId());
            }
        }

        QuotaDecision jobDecision = ledger.reserve(job.tenantId(), ResourceType.JOBS, 1);
        if (!jobDecision.allowed()) {
            return jobDecision;
        }
        QuotaDecision bytesDecision = ledger.reserve(job.tenantId(), ResourceType.ARTIFACTS, bytes);
        if (!bytesDecision.allowed()) {
            ledger.release(job.tenantId(), ResourceType.JOBS, 1);
            return bytesDecision;
        }

        List<String> registered = new ArrayList<>();
        try {
            for (ArtifactRecord a : outputs) {
                artifacts.register(a.jobId() == null
                        ? new ArtifactRecord(a.artifactId(), a.tenantId(), job.jobId(), a.createdAt(), a.sizeBytes())
                        : a);
                registered.add(a.artifactId());
            }
            List<String> ids = outputs.stream().map(ArtifactRecord::artifactId).toList();
            JobRecord recorded = job.artifactIds().isEmpty() && !ids.isEmpty()
                    ? new JobRecord(job.jobId(), job.tenantId(), job.createdAt(), job.status(), ids)
                    : job;
            jobs.register(recorded);
        } catch (RuntimeException e) {
            rollback(job, registered, bytes, e);
            throw e;
        }
        log.info("Admitted job {} for tenant {} with {} artifacts ({} bytes)", job.jobId(), job.tenantId(), outputs.size(), bytes);
        return bytesDecision;
    }

    private void rollback(JobRecord job, List<String> registered, long bytes, RuntimeException cause) {
        for (String artifactId : registered) {
            try {
                artifacts.unregister(artifactId);
            } catch (RuntimeException e) {
                cause.addSuppressed(e);
            }
        }
        ledger.release(job.tenantId(), ResourceType.JOBS, 1);
        ledger.release(job.tenantId(), ResourceType.ARTIFACTS, bytes);
        log.warn("Rolled back job {} for tenant {} after a registration failure: {}", job.jobId(), job.tenantId(), cause.getMessage());
    }
}
