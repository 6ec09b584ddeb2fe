package org.iceforge.governor.registry;

import java.util.Comparator;

final class RegistryOrdering {
    static final Comparator<JobRecord> JOBS_OLDEST_FIRST =
            Comparator.comparing(JobRecord::createdAt).thenComparing(JobRecord::jobId);
    static final Comparator<ArtifactRecord> ARTIFACTS_OLDEST_FIRST =
            Comparator.comparing(ArtifactRecord::createdAt).thenComparing(ArtifactRecord::artifactId);

    private RegistryOrdering() {}
}
