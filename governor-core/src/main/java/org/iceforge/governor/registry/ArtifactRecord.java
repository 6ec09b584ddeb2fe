package org.iceforge.governor.registry;

import org.iceforge.governor.cache.CacheKeys;

import java.time.Instant;
import java.util.Objects;

/**
 * A stored output. {@code jobId} is {@code null} for artifacts not produced by a tracked job.
 */
public record ArtifactRecord(String artifactId, String tenantId, String jobId, Instant createdAt, long sizeBytes) {

    public ArtifactRecord {
        Objects.requireNonNull(artifactId, "artifactId");
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(createdAt, "createdAt");
        if (sizeBytes < 0) throw new IllegalArgumentException("sizeBytes must be >= 0: " + sizeBytes);
    }

    /** Prefix of every cache key derived from this artifact. */
    public String cacheKeyPrefix() {
        return CacheKeys.artifactPrefix(artifactId);
    }
}
