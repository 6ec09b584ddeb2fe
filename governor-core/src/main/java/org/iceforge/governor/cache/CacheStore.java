package org.iceforge.governor.cache;

import org.iceforge.governor.events.GovernanceEventListener;
import org.iceforge.governor.events.GovernanceEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded in-memory result cache with least-recently-used ordering and per-entry TTL.
 * <p>
 * Bounds: after any operation returns, the store holds at most {@code maxEntries} entries and at
 * most {@code maxBytes} bytes. Room is made before a new entry is admitted by dropping expired
 * entries first, then the least-recently-used non-pinned ones.
 * <p>
 * Locking: a single read/write lock. {@link #get(String)} takes the write lock because it moves
 * the entry to the most-recent position and bumps its hit count. {@link #peek(String)},
 * {@link #containsKey(String)} and {@link #entries()} only take the read lock. Counters are
 * {@link LongAdder}s and the size gauges are volatile, so {@link #stats()} never waits on writers.
 * <p>
 * An expired entry reads as a miss whether or not it has been physically removed yet.
 */
public class CacheStore implements CacheMetrics {
    private static final Logger log = LoggerFactory.getLogger(CacheStore.class);

    private record Removal(CacheEntry entry, RemovalCause cause) {}

    private final long maxEntries;
    private final long maxBytes;
    private final Clock clock;
    private final GovernanceEventListener events;

    // Iteration order is recency order: a touched entry is re-inserted at the tail.
    private final LinkedHashMap<String, StoredEntry> entries = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<CacheRemovalListener> removalListeners = new CopyOnWriteArrayList<>();

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder evictions = new LongAdder();
    private final LongAdder expirations = new LongAdder();
    private volatile int currentSize;
    private volatile long currentBytes;

    public CacheStore(long maxEntries, long maxBytes) {
        this(maxEntries, maxBytes, Clock.systemUTC(), GovernanceEventListener.NOOP);
    }

    public CacheStore(long maxEntries, long maxBytes, Clock clock, GovernanceEventListener events) {
        if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0: " + maxEntries);
        if (maxBytes <= 0) throw new IllegalArgumentException("maxBytes must be > 0: " + maxBytes);
        this.maxEntries = maxEntries;
        this.maxBytes = maxBytes;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.events = events == null ? GovernanceEventListener.NOOP : events;
        log.info("Initialized cache store with maxEntries={} maxBytes={}", maxEntries, maxBytes);
    }

    public void addRemovalListener(CacheRemovalListener listener) {
        removalListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Returns the value if present and not expired, marking it most recently used.
     * Records a hit or a miss.
     */
    public Optional<byte[]> get(String key) {
        return lookup(key, true);
    }

    /**
     * Same as {@link #get(String)} but does not record a miss. Used by callers re-checking a key
     * whose miss they already recorded.
     */
    public Optional<byte[]> getIfPresent(String key) {
        return lookup(key, false);
    }

    private Optional<byte[]> lookup(String key, boolean countMiss) {
        Objects.requireNonNull(key, "key");
        List<Removal> removed = List.of();
        byte[] value = null;

        lock.writeLock().lock();
        try {
            StoredEntry e = entries.get(key);
            if (e != null) {
                Instant now = clock.instant();
                if (e.isExpired(now)) {
                    removeLocked(key);
                    expirations.increment();
                    removed = List.of(new Removal(e.snapshot(), RemovalCause.EXPIRED));
                } else {
                    e.hitCount++;
                    e.lastAccessedAt = now;
                    entries.remove(key);
                    entries.put(key, e);
                    value = e.value;
                }
            }
            if (value != null) {
                hits.increment();
            } else if (countMiss) {
                misses.increment();
            }
        } finally {
            lock.writeLock().unlock();
        }

        notifyRemovals(removed);
        if (value != null) {
            log.debug("Cache hit for {}", key);
            GovernanceEvents.publish(events, l -> l.cacheHit(key));
            return Optional.of(value);
        }
        if (countMiss) {
            log.debug("Cache miss for {}", key);
            GovernanceEvents.publish(events, l -> l.cacheMiss(key));
        }
        return Optional.empty();
    }

    public void put(String key, byte[] value, Duration ttl) {
        put(key, value, ttl, null);
    }

    public void put(String key, byte[] value, Duration ttl, String ownerTenant) {
        put(key, value, ttl, ownerTenant, value == null ? 0L : value.length);
    }

    /**
     * Inserts or replaces an entry and makes it the most recently used.
     *
     * @param ttl         time to live; {@code null} means the entry never expires
     * @param ownerTenant tenant charged for the entry, reported back through removal listeners
     * @param sizeBytes   accounted size of the entry
     * @throws EntryTooLargeException if the entry exceeds {@code maxBytes} on its own, or pinned
     *                                entries leave no room; nothing is evicted in that case
     */
    public void put(String key, byte[] value, Duration ttl, String ownerTenant, long sizeBytes) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (ttl != null && (ttl.isNegative() || ttl.isZero())) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        if (sizeBytes < 0) throw new IllegalArgumentException("sizeBytes must be >= 0: " + sizeBytes);
        if (sizeBytes > maxBytes) {
            log.warn("Value too large to cache: key={} size={} maxBytes={}", key, sizeBytes, maxBytes);
            throw new EntryTooLargeException(key, sizeBytes, maxBytes,
                    "Entry " + key + " is " + sizeBytes + " bytes, larger than the cache budget of " + maxBytes + " bytes");
        }

        List<Removal> removed = new ArrayList<>();
        EntryTooLargeException rejected = null;

        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            purgeExpiredLocked(now, removed);

            StoredEntry existing = entries.get(key);
            long count = entries.size() - (existing != null ? 1 : 0);
            long bytes = currentBytes - (existing != null ? existing.sizeBytes : 0L);

            // Pick victims first so an impossible admission evicts nothing.
            List<StoredEntry> victims = new ArrayList<>();
            Iterator<StoredEntry> lru = entries.values().iterator();
            while (count + 1 > maxEntries || bytes + sizeBytes > maxBytes) {
                StoredEntry victim = nextVictim(lru, key);
                if (victim == null) break;
                victims.add(victim);
                count--;
                bytes -= victim.sizeBytes;
            }

            if (count + 1 > maxEntries || bytes + sizeBytes > maxBytes) {
                rejected = new EntryTooLargeException(key, sizeBytes, maxBytes,
                        "No room for entry " + key + " (" + sizeBytes + " bytes): remaining entries are pinned");
            } else {
                if (existing != null) {
                    removeLocked(key);
                    removed.add(new Removal(existing.snapshot(), RemovalCause.REPLACED));
                }
                for (StoredEntry victim : victims) {
                    removeLocked(victim.key);
                    evictions.increment();
                    removed.add(new Removal(victim.snapshot(), RemovalCause.EVICTED));
                }
                boolean pinned = existing != null && existing.pinned;
                entries.put(key, new StoredEntry(key, value, ownerTenant, sizeBytes, now, expiryOf(now, ttl), pinned));
                currentSize = entries.size();
                currentBytes += sizeBytes;
            }
        } finally {
            lock.writeLock().unlock();
        }

        notifyRemovals(removed);
        if (rejected != null) {
            log.warn(rejected.getMessage());
            throw rejected;
        }
        log.debug("Cached {} ({} bytes, ttl={})", key, sizeBytes, ttl);
    }

    /**
     * Removes the entry if present. Idempotent.
     */
    public boolean invalidate(String key) {
        Objects.requireNonNull(key, "key");
        StoredEntry e;
        lock.writeLock().lock();
        try {
            e = removeLocked(key);
        } finally {
            lock.writeLock().unlock();
        }
        if (e == null) return false;
        notifyRemovals(List.of(new Removal(e.snapshot(), RemovalCause.EXPLICIT)));
        return true;
    }

    /**
     * Removes every key starting with {@code prefix}, e.g. all results for one table after ingestion.
     *
     * @return number of entries removed
     */
    public int invalidatePrefix(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        List<Removal> removed = new ArrayList<>();
        lock.writeLock().lock();
        try {
            Iterator<StoredEntry> it = entries.values().iterator();
            while (it.hasNext()) {
                StoredEntry e = it.next();
                if (e.key.startsWith(prefix)) {
                    it.remove();
                    currentBytes -= e.sizeBytes;
                    removed.add(new Removal(e.snapshot(), RemovalCause.PREFIX));
                }
            }
            currentSize = entries.size();
        } finally {
            lock.writeLock().unlock();
        }
        notifyRemovals(removed);
        if (!removed.isEmpty()) {
            log.info("Invalidated {} cache entries with prefix {}", removed.size(), prefix);
        }
        return removed.size();
    }

    /**
     * Marks an entry as exempt from LRU eviction. Expiry still applies.
     *
     * @return false if there is no live entry for the key
     */
    public boolean pin(String key) {
        return setPinned(key, true);
    }

    public boolean unpin(String key) {
        return setPinned(key, false);
    }

    private boolean setPinned(String key, boolean pinned) {
        Objects.requireNonNull(key, "key");
        lock.writeLock().lock();
        try {
            StoredEntry e = entries.get(key);
            if (e == null || e.isExpired(clock.instant())) return false;
            e.pinned = pinned;
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Physically drops expired entries. Reads already treat them as absent; this releases their
     * memory and their owners' accounted bytes.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        List<Removal> removed = new ArrayList<>();
        lock.writeLock().lock();
        try {
            purgeExpiredLocked(clock.instant(), removed);
        } finally {
            lock.writeLock().unlock();
        }
        notifyRemovals(removed);
        if (!removed.isEmpty()) {
            log.debug("Purged {} expired cache entries", removed.size());
        }
        return removed.size();
    }

    public void clear() {
        List<Removal> removed = new ArrayList<>();
        lock.writeLock().lock();
        try {
            for (StoredEntry e : entries.values()) {
                removed.add(new Removal(e.snapshot(), RemovalCause.CLEARED));
            }
            entries.clear();
            currentSize = 0;
            currentBytes = 0L;
        } finally {
            lock.writeLock().unlock();
        }
        notifyRemovals(removed);
        log.info("Cache cleared ({} entries)", removed.size());
    }

    /**
     * Metadata for a live entry without touching its recency or hit count.
     */
    public Optional<CacheEntry> peek(String key) {
        Objects.requireNonNull(key, "key");
        lock.readLock().lock();
        try {
            StoredEntry e = entries.get(key);
            if (e == null || e.isExpired(clock.instant())) return Optional.empty();
            return Optional.of(e.snapshot());
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean containsKey(String key) {
        return peek(key).isPresent();
    }

    /**
     * Live entries, least recently used first.
     */
    public List<CacheEntry> entries() {
        lock.readLock().lock();
        try {
            Instant now = clock.instant();
            List<CacheEntry> out = new ArrayList<>(entries.size());
            for (StoredEntry e : entries.values()) {
                if (!e.isExpired(now)) out.add(e.snapshot());
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    public CacheStats stats() {
        return new CacheStats(hits.sum(), misses.sum(), evictions.sum(), expirations.sum(), currentSize, currentBytes);
    }

    @Override
    public long hits() { return hits.sum(); }

    @Override
    public long misses() { return misses.sum(); }

    @Override
    public long bytesUsed() { return currentBytes; }

    public int size() { return currentSize; }
    public long maxEntries() { return maxEntries; }
    public long maxBytes() { return maxBytes; }

    private StoredEntry removeLocked(String key) {
        StoredEntry e = entries.remove(key);
        if (e != null) {
            currentSize = entries.size();
            currentBytes -= e.sizeBytes;
        }
        return e;
    }

    private void purgeExpiredLocked(Instant now, List<Removal> removed) {
        Iterator<StoredEntry> it = entries.values().iterator();
        while (it.hasNext()) {
            StoredEntry e = it.next();
            if (e.isExpired(now)) {
                it.remove();
                currentBytes -= e.sizeBytes;
                expirations.increment();
                removed.add(new Removal(e.snapshot(), RemovalCause.EXPIRED));
            }
        }
        currentSize = entries.size();
    }

    private static StoredEntry nextVictim(Iterator<StoredEntry> lru, String incomingKey) {
        while (lru.hasNext()) {
            StoredEntry e = lru.next();
            if (!e.pinned && !e.key.equals(incomingKey)) return e;
        }
        return null;
    }

    private static Instant expiryOf(Instant now, Duration ttl) {
        if (ttl == null) return null;
        try {
            return now.plus(ttl);
        } catch (DateTimeException | ArithmeticException e) {
            // ttl beyond Instant.MAX: treat as never expiring
            return null;
        }
    }

    private void notifyRemovals(List<Removal> removed) {
        for (Removal r : removed) {
            if (r.cause() == RemovalCause.EVICTED || r.cause() == RemovalCause.EXPIRED) {
                log.debug("Removed cache entry {} ({})", r.entry().key(), r.cause());
                GovernanceEvents.publish(events, l -> l.cacheEviction(r.entry().key(), r.cause()));
            }
            for (CacheRemovalListener listener : removalListeners) {
                try {
                    listener.onRemoval(r.entry(), r.cause());
                } catch (RuntimeException e) {
                    log.warn("Cache removal listener failed for key={} cause={}", r.entry().key(), r.cause(), e);
                }
            }
        }
    }
}
