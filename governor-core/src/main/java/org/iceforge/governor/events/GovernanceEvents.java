package org.iceforge.governor.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Delivers an event to a listener without letting listener failures leak into cache, ledger or
 * retention operations.
 */
public final class GovernanceEvents {
    private static final Logger log = LoggerFactory.getLogger(GovernanceEvents.class);

    private GovernanceEvents() {}

    public static void publish(GovernanceEventListener listener, Consumer<GovernanceEventListener> event) {
        if (listener == null || listener == GovernanceEventListener.NOOP) return;
        try {
            event.accept(listener);
        } catch (RuntimeException e) {
            log.warn("Governance event listener {} failed: {}", listener.getClass().getName(), e.toString());
        }
    }
}
