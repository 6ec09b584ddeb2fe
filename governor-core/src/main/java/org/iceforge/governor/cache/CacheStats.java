package org.iceforge.governor.cache;

/**
 * Counters since the store was created. {@code currentSize} and {@code currentBytes} are gauges.
 */
public record CacheStats(
        long hits,
        long misses,
        long evictions,
        long expirations,
        int currentSize,
        long currentBytes
) {
    public double hitRatePercent() {
        long total = hits + misses;
        if (total == 0) return 0.0;
        return (hits * 100.0) / total;
    }
}
