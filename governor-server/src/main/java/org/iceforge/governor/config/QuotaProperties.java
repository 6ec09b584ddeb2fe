package org.iceforge.governor.config;

import org.iceforge.governor.quota.QuotaTier;
import org.iceforge.governor.quota.ResourceType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Quota tiers and tenant assignments.
 * <pre>
 * governor.quota.tiers.free.jobs.limit=10
 * governor.quota.tiers.free.api-requests.limit=60
 * governor.quota.tiers.free.api-requests.window=1m
 * governor.quota.tenants.acme=professional
 * </pre>
 */
@ConfigurationProperties(prefix = "governor.quota")
public class QuotaProperties {

    /** Tier for tenants without an assignment. Blank means such tenants are unlimited. */
    private String defaultTier = "free";

    /** Tier name to resource name to limit. */
    private Map<String, Map<String, Limit>> tiers = new LinkedHashMap<>();

    /** Tenant id to tier name. */
    private Map<String, String> tenants = new LinkedHashMap<>();

    public static class Limit {
        /** Units allowed: a count for jobs and api-requests, bytes for artifacts and cache-bytes. */
        private long limit;

        /** Optional period after which consumption resets. */
        private Duration window;

        public long getLimit() { return limit; }
        public void setLimit(long limit) { this.limit = limit; }

        public Duration getWindow() { return window; }
        public void setWindow(Duration window) { this.window = window; }
    }

    /**
     * @throws IllegalArgumentException on an unknown resource name or invalid limit
     */
    public Map<String, QuotaTier> toTiers() {
        Map<String, QuotaTier> out = new LinkedHashMap<>();
        tiers.forEach((name, resources) -> {
            Map<ResourceType, Long> limits = new EnumMap<>(ResourceType.class);
            Map<ResourceType, Duration> windows = new EnumMap<>(ResourceType.class);
            if (resources != null) {
                resources.forEach((resource, l) -> {
                    ResourceType type = ResourceType.fromName(resource);
                    limits.put(type, l.getLimit());
                    if (l.getWindow() != null) windows.put(type, l.getWindow());
                });
            }
            out.put(name, new QuotaTier(name, limits, windows));
        });
        return out;
    }

    /** Default tier, or {@code null} when blank or when no tiers are configured. */
    public String effectiveDefaultTier() {
        if (defaultTier == null || defaultTier.isBlank() || tiers.isEmpty()) return null;
        return defaultTier;
    }

    public String getDefaultTier() { return defaultTier; }
    public void setDefaultTier(String defaultTier) { this.defaultTier = defaultTier; }

    public Map<String, Map<String, Limit>> getTiers() { return tiers; }
    public void setTiers(Map<String, Map<String, Limit>> tiers) { this.tiers = tiers; }

    public Map<String, String> getTenants() { return tenants; }
    public void setTenants(Map<String, String> tenants) { this.tenants = tenants; }
}
