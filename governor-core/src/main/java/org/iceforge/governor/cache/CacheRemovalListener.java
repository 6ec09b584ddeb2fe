package org.iceforge.governor.cache;

/**
 * Called after an entry has left the store. Invoked outside the store lock, in removal order.
 */
@FunctionalInterface
public interface CacheRemovalListener {
    void onRemoval(CacheEntry entry, RemovalCause cause);
}
