package org.iceforge.governor.quota;

import java.time.Duration;

/**
 * Per-resource usage joined with the active limit, for reporting.
 */
public record UsageSummary(ResourceType resource, long consumed, long limit, long remaining,
                           double utilizationPercent, Duration window) {

    static UsageSummary of(ResourceType resource, long consumed, QuotaPolicy policy) {
        if (policy == null) {
            return new UsageSummary(resource, consumed, QuotaDecision.UNLIMITED, QuotaDecision.UNLIMITED, 0.0d, null);
        }
        long limit = policy.limit();
        long remaining = Math.max(0L, limit - consumed);
        double pct = limit == 0 ? (consumed > 0 ? 100.0d : 0.0d) : (consumed * 100.0d) / limit;
        return new UsageSummary(resource, consumed, limit, remaining, pct, policy.window());
    }

    public boolean isUnlimited() {
        return limit == QuotaDecision.UNLIMITED;
    }
}
