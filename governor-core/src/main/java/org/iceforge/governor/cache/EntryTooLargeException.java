package org.iceforge.governor.cache;

/**
 * Raised by {@link CacheStore#put} when an entry cannot be admitted: it is larger than the whole
 * byte budget, or pinned entries leave no room for it. Nothing is evicted in either case.
 * <p>
 * Callers may still hand the value to their own caller; it just is not cached.
 */
public class EntryTooLargeException extends CacheException {
    private final String key;
    private final long sizeBytes;
    private final long maxBytes;

    public EntryTooLargeException(String key, long sizeBytes, long maxBytes, String message) {
        super(message);
        this.key = key;
        this.sizeBytes = sizeBytes;
        this.maxBytes = maxBytes;
    }

    public String key() { return key; }
    public long sizeBytes() { return sizeBytes; }
    public long maxBytes() { return maxBytes; }
}
