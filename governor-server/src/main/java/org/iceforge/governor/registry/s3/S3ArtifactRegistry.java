package org.iceforge.governor.registry.s3;

import org.iceforge.governor.registry.ArtifactRecord;
import org.iceforge.governor.registry.ArtifactRegistry;
import org.iceforge.governor.registry.RegistryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Artifact registry backed by an S3 bucket. The bucket listing is the source of truth; nothing is
 * stored besides the objects themselves.
 * <p>
 * Layout: {@code <prefix>/<tenantId>/<jobId>/<name>}, or {@code <prefix>/<tenantId>/<name>} for
 * artifacts without a job. The artifact id is the full object key.
 */
public class S3ArtifactRegistry implements ArtifactRegistry {
    private static final Logger log = LoggerFactory.getLogger(S3ArtifactRegistry.class);

    private static final Comparator<ArtifactRecord> OLDEST_FIRST =
            Comparator.comparing(ArtifactRecord::createdAt).thenComparing(ArtifactRecord::artifactId);

    private final S3Client s3;
    private final String bucket;
    private final String prefix;

    public S3ArtifactRegistry(S3Client s3, String bucket, String prefix) {
        this.s3 = Objects.requireNonNull(s3, "s3");
        this.bucket = Objects.requireNonNull(bucket, "bucket");
        String p = prefix == null ? "" : prefix.trim();
        while (p.endsWith("/")) p = p.substring(0, p.length() - 1);
        this.prefix = p;
    }

    /** Object key for an artifact under the registry layout. */
    public String keyFor(String tenantId, String jobId, String name) {
        StringBuilder sb = new StringBuilder();
        if (!prefix.isEmpty()) sb.append(prefix).append('/');
        sb.append(tenantId).append('/');
        if (jobId != null) sb.append(jobId).append('/');
        return sb.append(name).toString();
    }

    /**
     * Confirms the artifact's object exists. Registration is otherwise implicit: any object under
     * the prefix is an artifact.
     *
     * @throws RegistryException if the object is missing or S3 fails
     */
    @Override
    public void register(ArtifactRecord artifact) {
        Objects.requireNonNull(artifact, "artifact");
        if (head(artifact.artifactId()).isEmpty()) {
            throw new RegistryException("Artifact object not found: s3://" + bucket + "/" + artifact.artifactId());
        }
        log.debug("Registered artifact s3://{}/{}", bucket, artifact.artifactId());
    }

    /** The object stays; it was uploaded before registration and is not ours to remove. */
    @Override
    public void unregister(String artifactId) {
        log.debug("Unregistered artifact s3://{}/{}; object left in place", bucket, artifactId);
    }

    @Override
    public Optional<ArtifactRecord> find(String artifactId) {
        return head(artifactId).flatMap(h -> toRecord(artifactId, h.lastModified(), h.contentLength()));
    }

    @Override
    public List<ArtifactRecord> findCreatedBefore(Instant cutoff) {
        return list(rootPrefix()).stream()
                .filter(a -> a.createdAt().isBefore(cutoff))
                .sorted(OLDEST_FIRST)
                .toList();
    }

    @Override
    public Set<String> tenants() {
        Set<String> out = new TreeSet<>();
        for (ArtifactRecord a : list(rootPrefix())) out.add(a.tenantId());
        return out;
    }

    @Override
    public List<ArtifactRecord> findByTenant(String tenantId) {
        return list(rootPrefix() + tenantId + "/").stream().sorted(OLDEST_FIRST).toList();
    }

    @Override
    public boolean delete(String artifactId) {
        if (head(artifactId).isEmpty()) return false;
        try {
            s3.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(artifactId).build());
            log.info("Deleted artifact s3://{}/{}", bucket, artifactId);
            return true;
        } catch (SdkException e) {
            throw new RegistryException("S3 delete failed for s3://" + bucket + "/" + artifactId, e);
        }
    }

    @Override
    public int size() {
        return list(rootPrefix()).size();
    }

    private String rootPrefix() {
        return prefix.isEmpty() ? "" : prefix + "/";
    }

    private List<ArtifactRecord> list(String listPrefix) {
        List<ArtifactRecord> out = new ArrayList<>();
        String token = null;
        try {
            do {
                ListObjectsV2Request.Builder req = ListObjectsV2Request.builder().bucket(bucket).prefix(listPrefix);
                if (token != null) req.continuationToken(token);
                ListObjectsV2Response r = s3.listObjectsV2(req.build());
                for (S3Object o : r.contents()) {
                    toRecord(o.key(), o.lastModified(), o.size()).ifPresent(out::add);
                }
                token = Boolean.TRUE.equals(r.isTruncated()) ? r.nextContinuationToken() : null;
            } while (token != null);
        } catch (SdkException e) {
            throw new RegistryException("S3 list failed for s3://" + bucket + "/" + listPrefix, e);
        }
        return out;
    }

    private Optional<HeadObjectResponse> head(String key) {
        try {
            return Optional.of(s3.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build()));
        } catch (S3Exception e) {
            if (e.statusCode() == 404) return Optional.empty();
            throw new RegistryException("S3 head failed for s3://" + bucket + "/" + key, e);
        } catch (SdkException e) {
            throw new RegistryException("S3 head failed for s3://" + bucket + "/" + key, e);
        }
    }

    private Optional<ArtifactRecord> toRecord(String key, Instant lastModified, Long size) {
        String rel = key;
        if (!prefix.isEmpty()) {
            if (!key.startsWith(prefix + "/")) return Optional.empty();
            rel = key.substring(prefix.length() + 1);
        }
        String[] parts = rel.split("/");
        if (parts.length < 2 || rel.endsWith("/")) {
            // directory marker or object outside the tenant layout
            return Optional.empty();
        }
        String tenant = parts[0];
        String jobId = parts.length >= 3 ? parts[1] : null;
        Instant created = lastModified == null ? Instant.EPOCH : lastModified;
        long bytes = size == null ? 0L : size;
        return Optional.of(new ArtifactRecord(key, tenant, jobId, created, bytes));
    }
}
