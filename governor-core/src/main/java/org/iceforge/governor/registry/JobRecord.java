package org.iceforge.governor.registry;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record JobRecord(String jobId, String tenantId, Instant createdAt, JobStatus status, List<String> artifactIds) {

    public JobRecord {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(status, "status");
        artifactIds = artifactIds == null ? List.of() : List.copyOf(artifactIds);
    }

    public JobRecord withStatus(JobStatus newStatus) {
        return new JobRecord(jobId, tenantId, createdAt, newStatus, artifactIds);
    }
}
