package org.iceforge.governor.registry;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface JobRegistry {

    void register(JobRecord job);

    Optional<JobRecord> find(String jobId);

    /** Jobs created strictly before {@code cutoff}, oldest first. */
    List<JobRecord> findCreatedBefore(Instant cutoff);

    /**
     * Removes the job record. Its artifacts are the caller's concern.
     *
     * @return false if the job was already gone
     * @throws RegistryException if the backing store fails
     */
    boolean delete(String jobId);

    int size();
}
