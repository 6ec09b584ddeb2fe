package org.iceforge.governor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Where artifact records live.
 */
@ConfigurationProperties(prefix = "governor.registry")
public class RegistryProperties {

    /**
     * Artifact registry backend.
     * <p>
     * - "local" (default): in-memory registry, for development and tests
     * - "s3": enumerate artifacts stored under {@code s3://bucket/prefix/tenant/job/name}
     */
    private String store = "local";

    private S3 s3 = new S3();

    public static class S3 {
        private String bucket = "governor-artifacts";

        /** Prefix inside the bucket; tenants are the next path segment. */
        private String prefix = "artifacts";

        private String region = "us-east-1";

        /** Endpoint override for S3-compatible stores (MinIO, LocalStack). */
        private String endpoint;

        private boolean pathStyleAccess = false;

        public String getBucket() { return bucket; }
        public void setBucket(String bucket) { this.bucket = bucket; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }

        public String getRegion() { return region; }
        public void setRegion(String region) { this.region = region; }

        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }

        public boolean isPathStyleAccess() { return pathStyleAccess; }
        public void setPathStyleAccess(boolean pathStyleAccess) { this.pathStyleAccess = pathStyleAccess; }
    }

    public String getStore() { return store; }
    public void setStore(String store) { this.store = store; }

    public S3 getS3() { return s3; }
    public void setS3(S3 s3) { this.s3 = s3; }
}
