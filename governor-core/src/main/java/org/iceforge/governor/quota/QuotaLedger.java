package org.iceforge.governor.quota;

import org.iceforge.governor.events.GovernanceEventListener;
import org.iceforge.governor.events.GovernanceEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-tenant usage accounting against configurable limits.
 * <p>
 * Each (tenant, resource) pair has one {@link UsageCounter} held in a {@link ConcurrentHashMap}.
 * {@link #reserve} performs check and commit inside a single {@code compute} on that pair, so
 * concurrent reservations can never push consumption past the limit.
 * <p>
 * Policy resolution: explicit tenant policy, then the tenant's tier (or the default tier), then
 * unlimited. Lowering a limit below current consumption keeps the consumption; further
 * reservations are denied until releases bring it back under the limit.
 */
public class QuotaLedger {
    private static final Logger log = LoggerFactory.getLogger(QuotaLedger.class);

    private record CounterKey(String tenantId, ResourceType resource) {}

    private final ConcurrentHashMap<CounterKey, UsageCounter> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<CounterKey, QuotaPolicy> policies = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> tenantTiers = new ConcurrentHashMap<>();
    private final Map<String, QuotaTier> tiers;
    private final String defaultTier;
    private final Clock clock;
    private final GovernanceEventListener events;

    /** Ledger without tiers: every tenant is unlimited until a policy is set. */
    public QuotaLedger() {
        this(Map.of(), null, Clock.systemUTC(), GovernanceEventListener.NOOP);
    }

    public QuotaLedger(Map<String, QuotaTier> tiers, String defaultTier, Clock clock, GovernanceEventListener events) {
        this.tiers = Map.copyOf(Objects.requireNonNull(tiers, "tiers"));
        if (defaultTier != null && !this.tiers.containsKey(defaultTier)) {
            throw new IllegalArgumentException(unknownTier(defaultTier));
        }
        this.defaultTier = defaultTier;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.events = events == null ? GovernanceEventListener.NOOP : events;
        log.info("Quota ledger initialized with tiers={} defaultTier={}", new TreeSet<>(this.tiers.keySet()), defaultTier);
    }

    /**
     * Whether {@code amount} more units would fit. Changes nothing.
     */
    public QuotaDecision check(String tenantId, ResourceType resource, long amount) {
        validate(tenantId, resource, amount);
        QuotaPolicy policy = activePolicy(tenantId, resource).orElse(null);
        long consumed = current(tenantId, resource, policy, clock.instant());
        return decide(tenantId, resource, amount, consumed, policy);
    }

    /**
     * Atomically checks and, when allowed, commits {@code amount} units. A denial leaves usage
     * unchanged and is reported to the event listener.
     */
    public QuotaDecision reserve(String tenantId, ResourceType resource, long amount) {
        validate(tenantId, resource, amount);
        QuotaPolicy policy = activePolicy(tenantId, resource).orElse(null);
        QuotaDecision[] out = new QuotaDecision[1];
        counters.compute(new CounterKey(tenantId, resource), (k, existing) -> {
            Instant now = clock.instant();
            UsageCounter c = existing == null ? UsageCounter.empty(tenantId, resource, now) : existing.rolled(policy, now);
            QuotaDecision d = decide(tenantId, resource, amount, c.consumed(), policy);
            out[0] = d;
            if (!d.allowed()) return c;
            return c.withConsumed(c.consumed() + amount, now);
        });
        QuotaDecision decision = out[0];
        if (!decision.allowed()) {
            log.warn(decision.reason());
            GovernanceEvents.publish(events, l -> l.quotaDenied(decision));
        } else {
            log.debug("Reserved {} {} for tenant {} (now {})", amount, resource.propertyName(), tenantId, decision.current() + amount);
        }
        return decision;
    }

    /**
     * Returns {@code amount} units. Consumption never drops below zero.
     */
    public void release(String tenantId, ResourceType resource, long amount) {
        validate(tenantId, resource, amount);
        if (amount == 0) return;
        QuotaPolicy policy = activePolicy(tenantId, resource).orElse(null);
        counters.computeIfPresent(new CounterKey(tenantId, resource), (k, c) -> {
            Instant now = clock.instant();
            UsageCounter rolled = c.rolled(policy, now);
            if (amount > rolled.consumed()) {
                log.debug("Release of {} {} for tenant {} exceeds consumption {}; flooring at zero",
                        amount, resource.propertyName(), tenantId, rolled.consumed());
            }
            return rolled.withConsumed(Math.max(0L, rolled.consumed() - amount), now);
        });
    }

    /**
     * Snapshot of consumption for every resource; resources never used report zero.
     */
    public Map<ResourceType, Long> usage(String tenantId) {
        Objects.requireNonNull(tenantId, "tenantId");
        Instant now = clock.instant();
        Map<ResourceType, Long> out = new EnumMap<>(ResourceType.class);
        for (ResourceType r : ResourceType.values()) {
            out.put(r, current(tenantId, r, activePolicy(tenantId, r).orElse(null), now));
        }
        return out;
    }

    public List<UsageSummary> summary(String tenantId) {
        Objects.requireNonNull(tenantId, "tenantId");
        Instant now = clock.instant();
        List<UsageSummary> out = new ArrayList<>();
        for (ResourceType r : ResourceType.values()) {
            QuotaPolicy policy = activePolicy(tenantId, r).orElse(null);
            out.add(UsageSummary.of(r, current(tenantId, r, policy, now), policy));
        }
        return out;
    }

    /** Replaces any explicit policy for the policy's tenant and resource. */
    public void setPolicy(QuotaPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        QuotaPolicy previous = policies.put(new CounterKey(policy.tenantId(), policy.resource()), policy);
        log.info("Quota policy for tenant {} {}: {} -> {}", policy.tenantId(), policy.resource().propertyName(),
                previous == null ? "none" : previous.limit(), policy.limit());
    }

    public boolean removePolicy(String tenantId, ResourceType resource) {
        return policies.remove(new CounterKey(tenantId, resource)) != null;
    }

    public void assignTier(String tenantId, String tierName) {
        Objects.requireNonNull(tenantId, "tenantId");
        if (tierName == null || !tiers.containsKey(tierName)) {
            throw new IllegalArgumentException(unknownTier(tierName));
        }
        tenantTiers.put(tenantId, tierName);
        log.info("Tenant {} assigned to tier {}", tenantId, tierName);
    }

    /** The tenant's tier, the default tier, or {@code null} when neither exists. */
    public String tierOf(String tenantId) {
        return tenantTiers.getOrDefault(tenantId, defaultTier);
    }

    public Optional<QuotaPolicy> activePolicy(String tenantId, ResourceType resource) {
        QuotaPolicy explicit = policies.get(new CounterKey(tenantId, resource));
        if (explicit != null) return Optional.of(explicit);
        String tierName = tierOf(tenantId);
        if (tierName == null) return Optional.empty();
        QuotaTier tier = tiers.get(tierName);
        return Optional.ofNullable(tier == null ? null : tier.policyFor(tenantId, resource));
    }

    /** Drops all consumption recorded for the tenant. Policies and tier stay. */
    public void reset(String tenantId) {
        Objects.requireNonNull(tenantId, "tenantId");
        counters.keySet().removeIf(k -> k.tenantId().equals(tenantId));
        log.info("Quota usage reset for tenant {}", tenantId);
    }

    /** Tenants with recorded usage, explicit policies or an assigned tier. */
    public Set<String> tenants() {
        Set<String> out = new TreeSet<>();
        counters.keySet().forEach(k -> out.add(k.tenantId()));
        policies.keySet().forEach(k -> out.add(k.tenantId()));
        out.addAll(tenantTiers.keySet());
        return out;
    }

    public Map<String, QuotaTier> tiers() {
        return new LinkedHashMap<>(tiers);
    }

    private long current(String tenantId, ResourceType resource, QuotaPolicy policy, Instant now) {
        UsageCounter c = counters.get(new CounterKey(tenantId, resource));
        return c == null ? 0L : c.rolled(policy, now).consumed();
    }

    private static QuotaDecision decide(String tenantId, ResourceType resource, long amount, long consumed, QuotaPolicy policy) {
        if (policy == null) {
            return QuotaDecision.allow(tenantId, resource, amount, consumed, QuotaDecision.UNLIMITED);
        }
        long limit = policy.limit();
        // amount <= limit - consumed, written so it cannot overflow
        boolean fits = amount == 0 || (consumed <= limit && amount <= limit - consumed);
        return fits
                ? QuotaDecision.allow(tenantId, resource, amount, consumed, limit)
                : QuotaDecision.deny(tenantId, resource, amount, consumed, limit);
    }

    private static void validate(String tenantId, ResourceType resource, long amount) {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(resource, "resource");
        if (amount < 0) throw new IllegalArgumentException("amount must be >= 0: " + amount);
    }

    private String unknownTier(String tierName) {
        return "Unknown tier: " + tierName + ". Valid tiers: " + new TreeSet<>(tiers.keySet());
    }
}
