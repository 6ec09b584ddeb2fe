package org.iceforge.governor.cache;

import java.time.Instant;

/**
 * Read-only view of a cached entry's metadata. The value itself is only handed out by
 * {@link CacheStore#get(String)}.
 *
 * @param ownerTenant tenant whose quota pays for the entry, or {@code null} when unaccounted
 * @param expiresAt   {@code null} when the entry never expires
 */
public record CacheEntry(
        String key,
        String ownerTenant,
        long sizeBytes,
        Instant createdAt,
        Instant expiresAt,
        Instant lastAccessedAt,
        long hitCount,
        boolean pinned
) {
    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
