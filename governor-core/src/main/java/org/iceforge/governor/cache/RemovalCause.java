package org.iceforge.governor.cache;

/**
 * Why an entry left the {@link CacheStore}.
 */
public enum RemovalCause {
    /** {@link CacheStore#invalidate(String)}. */
    EXPLICIT,
    /** {@link CacheStore#invalidatePrefix(String)}. */
    PREFIX,
    /** Overwritten by a put for the same key. */
    REPLACED,
    /** Least-recently-used eviction to make room. */
    EVICTED,
    /** TTL elapsed. */
    EXPIRED,
    /** {@link CacheStore#clear()}. */
    CLEARED
}
