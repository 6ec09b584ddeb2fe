// java
package org.iceforge.governor.cache;

import org.iceforge.governor.events.GovernanceEventListener;
import org.iceforge.governor.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CacheStoreTest {

    private MutableClock clock;
    private List<String> removals;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-01-01T00:00:00Z");
        removals = new ArrayList<>();
    }

    private CacheStore store(long maxEntries, long maxBytes) {
        CacheStore s = new CacheStore(maxEntries, maxBytes, clock, GovernanceEventListener.NOOP);
        s.addRemovalListener((e, cause) -> removals.add(e.key() + ":" + cause));
        return s;
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void get_evictsLeastRecentlyUsedWhenEntryCapReached() {
        CacheStore s = store(2, 1024);
        s.put("a", bytes("1"), null);
        s.put("b", bytes("2"), null);
        assertTrue(s.get("a").isPresent());

        s.put("c", bytes("3"), null);

        assertTrue(s.get("b").isEmpty(), "b was least recently used");
        assertArrayEquals(bytes("1"), s.get("a").orElseThrow());
        assertArrayEquals(bytes("3"), s.get("c").orElseThrow());
        assertEquals(1L, s.stats().evictions());
        assertTrue(removals.contains("b:EVICTED"));
    }

    @Test
    void put_evictsUntilByteBudgetFits() {
        CacheStore s = store(10, 10);
        s.put("a", new byte[4], null);
        s.put("b", new byte[4], null);
        s.put("c", new byte[6], null);

        assertFalse(s.containsKey("a"));
        assertTrue(s.containsKey("b"));
        assertTrue(s.containsKey("c"));
        assertEquals(10L, s.bytesUsed());

        s.put("d", new byte[9], null);
        assertEquals(1, s.size());
        assertEquals(9L, s.bytesUsed());
    }

    @Test
    void get_treatsExpiredEntryAsMiss() {
        CacheStore s = store(10, 1024);
        s.put("k", bytes("v"), Duration.ofSeconds(10));

        clock.advance(Duration.ofSeconds(9));
        assertTrue(s.get("k").isPresent());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(s.get("k").isEmpty());
        assertFalse(s.peek("k").isPresent());

        CacheStats stats = s.stats();
        assertEquals(1L, stats.hits());
        assertEquals(1L, stats.misses());
        assertEquals(1L, stats.expirations());
        assertEquals(0, stats.currentSize());
        assertEquals(0L, stats.currentBytes());
        assertEquals(List.of("k:EXPIRED"), removals);
    }

    @Test
    void put_rejectsEntryLargerThanBudgetWithoutEvicting() {
        CacheStore s = store(10, 8);
        s.put("small", new byte[4], null);

        EntryTooLargeException ex = assertThrows(EntryTooLargeException.class, () -> s.put("big", new byte[9], null));
        assertEquals("big", ex.key());
        assertEquals(9L, ex.sizeBytes());
        assertEquals(8L, ex.maxBytes());
        assertTrue(s.containsKey("small"));
        assertTrue(removals.isEmpty());
    }

    @Test
    void put_rejectsWhenPinnedEntriesLeaveNoRoom() {
        CacheStore s = store(2, 1024);
        s.put("a", bytes("1"), null);
        s.put("b", bytes("2"), null);
        assertTrue(s.pin("a"));
        assertTrue(s.pin("b"));

        assertThrows(EntryTooLargeException.class, () -> s.put("c", bytes("3"), null));
        assertTrue(s.containsKey("a"));
        assertTrue(s.containsKey("b"));

        assertTrue(s.unpin("a"));
        s.put("c", bytes("3"), null);
        assertFalse(s.containsKey("a"));
        assertTrue(s.containsKey("b"));
    }

    @Test
    void pin_skipsPinnedEntryDuringEviction() {
        CacheStore s = store(2, 1024);
        s.put("a", bytes("1"), null);
        s.put("b", bytes("2"), null);
        s.pin("a");

        s.put("c", bytes("3"), null);

        assertTrue(s.containsKey("a"));
        assertFalse(s.containsKey("b"));
    }

    @Test
    void put_replacingKeepsPinAndResetsRecency() {
        CacheStore s = store(2, 1024);
        s.put("a", bytes("1"), null);
        s.pin("a");
        s.put("a", bytes("11"), null);

        assertTrue(s.peek("a").orElseThrow().pinned());
        assertEquals(2L, s.bytesUsed());
        assertEquals(List.of("a:REPLACED"), removals);
    }

    @Test
    void invalidatePrefix_removesMatchingKeysOnly() {
        CacheStore s = store(10, 1024);
        s.put(CacheKeys.forTable("orders", "select 1"), bytes("1"), null);
        s.put(CacheKeys.forTable("orders", "select 2"), bytes("2"), null);
        s.put(CacheKeys.forTable("users", "select 1"), bytes("3"), null);

        assertEquals(2, s.invalidatePrefix(CacheKeys.tablePrefix("orders")));
        assertEquals(1, s.size());
        assertEquals(0, s.invalidatePrefix(CacheKeys.tablePrefix("orders")));
    }

    @Test
    void invalidate_isIdempotent() {
        CacheStore s = store(10, 1024);
        s.put("k", bytes("v"), null);
        assertTrue(s.invalidate("k"));
        assertFalse(s.invalidate("k"));
        assertEquals(List.of("k:EXPLICIT"), removals);
    }

    @Test
    void purgeExpired_dropsOnlyExpiredEntries() {
        CacheStore s = store(10, 1024);
        s.put("short", bytes("1"), Duration.ofSeconds(1));
        s.put("long", bytes("2"), Duration.ofHours(1));
        s.put("forever", bytes("3"), null);

        clock.advance(Duration.ofMinutes(1));
        assertEquals(1, s.purgeExpired());
        assertEquals(2, s.size());
        assertEquals(0, s.purgeExpired());
    }

    @Test
    void peek_doesNotChangeRecencyOrHits() {
        CacheStore s = store(2, 1024);
        s.put("a", bytes("1"), null);
        s.put("b", bytes("2"), null);
        assertTrue(s.peek("a").isPresent());

        s.put("c", bytes("3"), null);

        assertFalse(s.containsKey("a"));
        assertEquals(0L, s.hits());
    }

    @Test
    void entries_listsLeastRecentlyUsedFirst() {
        CacheStore s = store(10, 1024);
        s.put("a", bytes("1"), null, "t1");
        s.put("b", bytes("2"), null, "t2");
        s.get("a");

        List<CacheEntry> entries = s.entries();
        assertEquals("b", entries.get(0).key());
        assertEquals("a", entries.get(1).key());
        assertEquals("t1", entries.get(1).ownerTenant());
        assertEquals(1L, entries.get(1).hitCount());
    }

    @Test
    void clear_notifiesEveryEntry() {
        CacheStore s = store(10, 1024);
        s.put("a", bytes("1"), null);
        s.put("b", bytes("2"), null);
        s.clear();
        assertEquals(0, s.size());
        assertEquals(0L, s.bytesUsed());
        assertEquals(2, removals.size());
    }

    @Test
    void removalListenerFailure_doesNotBreakStore() {
        CacheStore s = store(1, 1024);
        s.addRemovalListener((e, cause) -> { throw new IllegalStateException("boom"); });
        s.put("a", bytes("1"), null);
        s.put("b", bytes("2"), null);
        assertTrue(s.containsKey("b"));
        assertEquals(List.of("a:EVICTED"), removals);
    }

    @Test
    void put_rejectsNonPositiveTtl() {
        CacheStore s = store(10, 1024);
        assertThrows(IllegalArgumentException.class, () -> s.put("k", bytes("v"), Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> s.put("k", bytes("v"), Duration.ofSeconds(-1)));
    }

    @Test
    void getIfPresent_doesNotCountMiss() {
        CacheStore s = store(10, 1024);
        assertTrue(s.getIfPresent("nope").isEmpty());
        assertEquals(0L, s.misses());
        assertTrue(s.get("nope").isEmpty());
        assertEquals(1L, s.misses());
    }

    @Test
    void stats_reportsHitRate() {
        CacheStore s = store(10, 1024);
        s.put("k", bytes("v"), null);
        s.get("k");
        s.get("k");
        s.get("k");
        s.get("missing");
        assertEquals(75.0d, s.stats().hitRatePercent(), 0.0001d);
    }
}
