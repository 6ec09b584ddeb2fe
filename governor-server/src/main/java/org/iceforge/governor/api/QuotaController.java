package org.iceforge.governor.api;

import org.iceforge.governor.quota.QuotaLedger;
import org.iceforge.governor.quota.QuotaPolicy;
import org.iceforge.governor.quota.ResourceType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@RestController
@RequestMapping("/api/quotas")
public class QuotaController {

    private final QuotaLedger ledger;

    public QuotaController(QuotaLedger ledger) {
        this.ledger = Objects.requireNonNull(ledger);
    }

    public record PolicyRequest(Long limit, Long windowSeconds) {}

    public record TierRequest(String tier) {}

    @GetMapping
    public Map<String, Object> overview() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("tiers", ledger.tiers().keySet());
        out.put("tenants", ledger.tenants());
        return out;
    }

    @GetMapping("/{tenant}")
    public Map<String, Object> tenant(@PathVariable("tenant") String tenant) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("tenantId", tenant);
        out.put("tier", ledger.tierOf(tenant));
        out.put("usage", ledger.summary(tenant));
        return out;
    }

    @PutMapping("/{tenant}/tier")
    public Map<String, Object> assignTier(@PathVariable("tenant") String tenant, @RequestBody TierRequest req) {
        ledger.assignTier(tenant, req == null ? null : req.tier());
        return tenant(tenant);
    }

    @PutMapping("/{tenant}/{resource}")
    public QuotaPolicy setPolicy(@PathVariable("tenant") String tenant,
                                 @PathVariable("resource") String resource,
                                 @RequestBody PolicyRequest req) {
        if (req == null || req.limit() == null) {
            throw new IllegalArgumentException("limit is required");
        }
        Duration window = req.windowSeconds() == null ? null : Duration.ofSeconds(req.windowSeconds());
        QuotaPolicy policy = new QuotaPolicy(tenant, ResourceType.fromName(resource), req.limit(), window);
        ledger.setPolicy(policy);
        return policy;
    }

    @DeleteMapping("/{tenant}/{resource}")
    public ResponseEntity<Void> removePolicy(@PathVariable("tenant") String tenant,
                                             @PathVariable("resource") String resource) {
        boolean removed = ledger.removePolicy(tenant, ResourceType.fromName(resource));
        return removed ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }
}
