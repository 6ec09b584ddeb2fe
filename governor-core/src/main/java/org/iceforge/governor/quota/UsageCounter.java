package org.iceforge.governor.quota;

import java.time.Instant;

/**
 * Immutable snapshot of one tenant's consumption of one resource. The ledger swaps counters
 * atomically rather than mutating them.
 */
public record UsageCounter(String tenantId, ResourceType resource, long consumed, Instant updatedAt, Instant windowStart) {

    static UsageCounter empty(String tenantId, ResourceType resource, Instant now) {
        return new UsageCounter(tenantId, resource, 0L, now, now);
    }

    UsageCounter withConsumed(long newConsumed, Instant now) {
        return new UsageCounter(tenantId, resource, newConsumed, now, windowStart);
    }

    /**
     * Counter as seen under {@code policy} at {@code now}: a windowed counter whose window has
     * elapsed starts over from zero.
     */
    UsageCounter rolled(QuotaPolicy policy, Instant now) {
        if (policy == null || policy.window() == null) return this;
        if (now.isBefore(windowStart.plus(policy.window()))) return this;
        return new UsageCounter(tenantId, resource, 0L, now, now);
    }
}
