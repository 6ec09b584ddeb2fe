package org.iceforge.governor.cache;

import java.time.Instant;

/**
 * Mutable entry owned by {@link CacheStore}. Only touched while the store's write lock is held,
 * except for reads under the read lock.
 */
final class StoredEntry {
    final String key;
    final byte[] value;
    final String ownerTenant;
    final long sizeBytes;
    final Instant createdAt;
    final Instant expiresAt;
    Instant lastAccessedAt;
    long hitCount;
    boolean pinned;

    StoredEntry(String key, byte[] value, String ownerTenant, long sizeBytes,
                Instant createdAt, Instant expiresAt, boolean pinned) {
        this.key = key;
        this.value = value;
        this.ownerTenant = ownerTenant;
        this.sizeBytes = sizeBytes;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.lastAccessedAt = createdAt;
        this.pinned = pinned;
    }

    boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    CacheEntry snapshot() {
        return new CacheEntry(key, ownerTenant, sizeBytes, createdAt, expiresAt, lastAccessedAt, hitCount, pinned);
    }
}
