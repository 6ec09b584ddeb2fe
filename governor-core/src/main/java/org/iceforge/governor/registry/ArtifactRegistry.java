package org.iceforge.governor.registry;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public interface ArtifactRegistry {

    void register(ArtifactRecord artifact);

    Optional<ArtifactRecord> find(String artifactId);

    /** Artifacts created strictly before {@code cutoff}, oldest first. */
    List<ArtifactRecord> findCreatedBefore(Instant cutoff);

    Set<String> tenants();

    /** The tenant's artifacts, oldest first. */
    List<ArtifactRecord> findByTenant(String tenantId);

    /**
     * @return false if the artifact was already gone
     * @throws RegistryException if the backing store fails
     */
    boolean delete(String artifactId);

    /**
     * Drops a registration made by {@link #register} without touching stored content. Registries that
     * keep nothing besides the content itself have nothing to drop.
     */
    default void unregister(String artifactId) {
        delete(artifactId);
    }

    int size();
}
