package org.iceforge.governor.events;

import org.iceforge.governor.cache.RemovalCause;
import org.iceforge.governor.quota.QuotaDecision;
import org.iceforge.governor.retention.PruneStats;

/**
 * Sink for the events the governance layer emits. The layer does not own logging or metrics
 * backends; it only reports to whatever listener it was constructed with.
 * <p>
 * Implementations must be cheap and must not block: they are called on request threads.
 */
public interface GovernanceEventListener {

    GovernanceEventListener NOOP = new GovernanceEventListener() {};

    default void cacheHit(String key) {}

    default void cacheMiss(String key) {}

    default void cacheEviction(String key, RemovalCause cause) {}

    default void quotaDenied(QuotaDecision decision) {}

    default void pruneCompleted(PruneStats stats) {}
}
