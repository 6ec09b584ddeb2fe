package org.iceforge.governor.events;

import org.iceforge.governor.cache.RemovalCause;
import org.iceforge.governor.quota.QuotaDecision;
import org.iceforge.governor.retention.PruneStats;

import java.util.List;
import java.util.Objects;

/**
 * Fans every event out to an explicit, ordered list of listeners. A failing listener is logged and
 * skipped; the remaining listeners still receive the event.
 */
public final class CompositeGovernanceEventListener implements GovernanceEventListener {

    private final List<GovernanceEventListener> listeners;

    public CompositeGovernanceEventListener(List<? extends GovernanceEventListener> listeners) {
        this.listeners = List.copyOf(Objects.requireNonNull(listeners, "listeners"));
    }

    public List<GovernanceEventListener> listeners() {
        return listeners;
    }

    @Override
    public void cacheHit(String key) {
        for (GovernanceEventListener l : listeners) GovernanceEvents.publish(l, x -> x.cacheHit(key));
    }

    @Override
    public void cacheMiss(String key) {
        for (GovernanceEventListener l : listeners) GovernanceEvents.publish(l, x -> x.cacheMiss(key));
    }

    @Override
    public void cacheEviction(String key, RemovalCause cause) {
        for (GovernanceEventListener l : listeners) GovernanceEvents.publish(l, x -> x.cacheEviction(key, cause));
    }

    @Override
    public void quotaDenied(QuotaDecision decision) {
        for (GovernanceEventListener l : listeners) GovernanceEvents.publish(l, x -> x.quotaDenied(decision));
    }

    @Override
    public void pruneCompleted(PruneStats stats) {
        for (GovernanceEventListener l : listeners) GovernanceEvents.publish(l, x -> x.pruneCompleted(stats));
    }
}
