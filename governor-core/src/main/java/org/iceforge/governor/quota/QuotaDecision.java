package org.iceforge.governor.quota;

/**
 * Outcome of a quota check or reservation. A denial is an ordinary result, not an error.
 */
public record QuotaDecision(boolean allowed, String tenantId, ResourceType resource,
                            long requested, long current, long limit, String reason) {

    /** Limit reported when no policy applies to the tenant and resource. */
    public static final long UNLIMITED = Long.MAX_VALUE;

    static QuotaDecision allow(String tenantId, ResourceType resource, long requested, long current, long limit) {
        return new QuotaDecision(true, tenantId, resource, requested, current, limit, null);
    }

    static QuotaDecision deny(String tenantId, ResourceType resource, long requested, long current, long limit) {
        String reason = "Quota exceeded for tenant " + tenantId + ": " + resource.propertyName()
                + " " + current + "/" + limit + ", requested " + requested;
        return new QuotaDecision(false, tenantId, resource, requested, current, limit, reason);
    }

    public boolean isUnlimited() {
        return limit == UNLIMITED;
    }

    /** Headroom left under the limit; {@link #UNLIMITED} when no policy applies. */
    public long remaining() {
        if (isUnlimited()) return UNLIMITED;
        return Math.max(0L, limit - current);
    }
}
