package org.iceforge.governor.api;

import org.iceforge.governor.cache.CacheEntry;
import org.iceforge.governor.cache.CacheStats;
import org.iceforge.governor.cache.CacheStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@RestController
@RequestMapping("/api/cache")
public class CacheController {

    private final CacheStore store;

    public CacheController(CacheStore store) {
        this.store = Objects.requireNonNull(store);
    }

    @GetMapping("/stats")
    public Map<String, Object> stats() {
        CacheStats s = store.stats();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("hits", s.hits());
        out.put("misses", s.misses());
        out.put("hitRatePercent", s.hitRatePercent());
        out.put("evictions", s.evictions());
        out.put("expirations", s.expirations());
        out.put("entries", s.currentSize());
        out.put("bytesUsed", s.currentBytes());
        out.put("maxEntries", store.maxEntries());
        out.put("maxBytes", store.maxBytes());
        return out;
    }

    /** Live entries, least recently used first. */
    @GetMapping("/entries")
    public List<CacheEntry> entries() {
        return store.entries();
    }

    @DeleteMapping("/{key}")
    public ResponseEntity<Void> invalidate(@PathVariable("key") String key) {
        return store.invalidate(key) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    @DeleteMapping
    public Map<String, Object> invalidatePrefix(@RequestParam("prefix") String prefix) {
        if (prefix.isBlank()) {
            throw new IllegalArgumentException("prefix must not be blank");
        }
        return Map.of("prefix", prefix, "removed", store.invalidatePrefix(prefix));
    }

    @PostMapping("/{key}/pin")
    public ResponseEntity<Void> pin(@PathVariable("key") String key) {
        return store.pin(key) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    @DeleteMapping("/{key}/pin")
    public ResponseEntity<Void> unpin(@PathVariable("key") String key) {
        return store.unpin(key) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }
}
