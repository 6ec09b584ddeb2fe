package org.iceforge.governor.quota;

import java.time.Duration;
import java.util.Objects;

/**
 * Limit for one (tenant, resource) pair. A {@code null} window means the limit applies to the
 * running total; otherwise consumption resets to zero every {@code window}.
 */
public record QuotaPolicy(String tenantId, ResourceType resource, long limit, Duration window) {

    public QuotaPolicy {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(resource, "resource");
        if (limit < 0) throw new IllegalArgumentException("limit must be >= 0: " + limit);
        if (window != null && (window.isZero() || window.isNegative())) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
    }

    public QuotaPolicy(String tenantId, ResourceType resource, long limit) {
        this(tenantId, resource, limit, null);
    }

    public boolean isWindowed() {
        return window != null;
    }
}
