package org.iceforge.governor.cache;

public interface CacheMetrics {
    long hits();
    long misses();
    long bytesUsed();
}
