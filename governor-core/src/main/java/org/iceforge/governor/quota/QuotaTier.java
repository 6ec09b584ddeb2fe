package org.iceforge.governor.quota;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Named bundle of limits assigned to tenants, e.g. free, starter, professional. A resource missing
 * from {@code limits} is unlimited for tenants on this tier.
 */
public record QuotaTier(String name, Map<ResourceType, Long> limits, Map<ResourceType, Duration> windows) {

    public QuotaTier {
        Objects.requireNonNull(name, "name");
        limits = limits == null || limits.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(limits));
        windows = windows == null || windows.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(windows));
        limits.forEach((r, l) -> {
            if (l == null || l < 0) throw new IllegalArgumentException("Tier " + name + ": invalid limit for " + r.propertyName() + ": " + l);
        });
    }

    public QuotaTier(String name, Map<ResourceType, Long> limits) {
        this(name, limits, Map.of());
    }

    /**
     * The tier's limit for {@code resource} expressed as a tenant policy, or {@code null} when the
     * tier leaves the resource unlimited.
     */
    QuotaPolicy policyFor(String tenantId, ResourceType resource) {
        Long limit = limits.get(resource);
        if (limit == null) return null;
        return new QuotaPolicy(tenantId, resource, limit, windows.get(resource));
    }
}
