package org.iceforge.governor.api;

import org.iceforge.governor.cache.CacheStore;
import org.iceforge.governor.metrics.GovernanceMetricsRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@RestController
@RequestMapping("/api")
public class MetricsController {

    private final GovernanceMetricsRegistry metrics;
    private final CacheStore store;

    public MetricsController(GovernanceMetricsRegistry metrics, CacheStore store) {
        this.metrics = Objects.requireNonNull(metrics);
        this.store = Objects.requireNonNull(store);
    }

    @GetMapping("/metrics")
    public Map<String, Object> metrics() {
        Map<String, Object> out = new LinkedHashMap<>(metrics.snapshot());
        out.put("cacheBytesUsed", store.bytesUsed());
        out.put("cacheEntries", store.size());
        return out;
    }
}
