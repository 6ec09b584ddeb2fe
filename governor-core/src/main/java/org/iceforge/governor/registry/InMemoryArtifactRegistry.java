package org.iceforge.governor.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class InMemoryArtifactRegistry implements ArtifactRegistry {
    private static final Logger log = LoggerFactory.getLogger(InMemoryArtifactRegistry.class);

    private final ConcurrentHashMap<String, ArtifactRecord> artifacts = new ConcurrentHashMap<>();

    @Override
    public void register(ArtifactRecord artifact) {
        Objects.requireNonNull(artifact, "artifact");
        artifacts.put(artifact.artifactId(), artifact);
        log.debug("Registered artifact {} ({} bytes) for tenant {}", artifact.artifactId(), artifact.sizeBytes(), artifact.tenantId());
    }

    @Override
    public Optional<ArtifactRecord> find(String artifactId) {
        return Optional.ofNullable(artifacts.get(artifactId));
    }

    @Override
    public List<ArtifactRecord> findCreatedBefore(Instant cutoff) {
        return artifacts.values().stream()
                .filter(a -> a.createdAt().isBefore(cutoff))
                .sorted(RegistryOrdering.ARTIFACTS_OLDEST_FIRST)
                .toList();
    }

    @Override
    public Set<String> tenants() {
        return artifacts.values().stream().map(ArtifactRecord::tenantId).collect(Collectors.toCollection(TreeSet::new));
    }

    @Override
    public List<ArtifactRecord> findByTenant(String tenantId) {
        return artifacts.values().stream()
                .filter(a -> a.tenantId().equals(tenantId))
                .sorted(RegistryOrdering.ARTIFACTS_OLDEST_FIRST)
                .toList();
    }

    @Override
    public boolean delete(String artifactId) {
        return artifacts.remove(artifactId) != null;
    }

    @Override
    public int size() {
        return artifacts.size();
    }
}
