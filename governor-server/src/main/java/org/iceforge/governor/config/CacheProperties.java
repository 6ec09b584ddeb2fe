package org.iceforge.governor.config;

import org.iceforge.governor.query.FacadeOptions;
import org.iceforge.governor.util.DataSizeParser;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration for the in-memory result cache and the compute path in front of it.
 */
@ConfigurationProperties(prefix = "governor.cache")
public class CacheProperties {

    /** Maximum number of cached results. */
    private long maxEntries = 1000;

    /** Total byte budget, e.g. "100MB", "1GiB" or "64*1024*1024". */
    private String maxBytes = "100MB";

    /** TTL applied when a request does not carry one. */
    private Duration defaultTtl = Duration.ofMinutes(5);

    /** Quota reservation made before computing a result of unknown size. */
    private String estimateBytes = "64KB";

    /** Threads running query computations. */
    private int computeThreads = 4;

    /** How long a request waits for its result. */
    private Duration computeTimeout = Duration.ofSeconds(60);

    public long maxBytesValue() {
        return DataSizeParser.parseBytes(maxBytes);
    }

    public FacadeOptions toFacadeOptions() {
        return new FacadeOptions(defaultTtl, DataSizeParser.parseBytes(estimateBytes), computeTimeout);
    }

    public long getMaxEntries() {
        return maxEntries;
    }

    public void setMaxEntries(long maxEntries) {
        this.maxEntries = maxEntries;
    }

    public String getMaxBytes() {
        return maxBytes;
    }

    public void setMaxBytes(String maxBytes) {
        this.maxBytes = maxBytes;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public void setDefaultTtl(Duration defaultTtl) {
        this.defaultTtl = defaultTtl;
    }

    public String getEstimateBytes() {
        return estimateBytes;
    }

    public void setEstimateBytes(String estimateBytes) {
        this.estimateBytes = estimateBytes;
    }

    public int getComputeThreads() {
        return computeThreads;
    }

    public void setComputeThreads(int computeThreads) {
        this.computeThreads = computeThreads;
    }

    public Duration getComputeTimeout() {
        return computeTimeout;
    }

    public void setComputeTimeout(Duration computeTimeout) {
        this.computeTimeout = computeTimeout;
    }
}
