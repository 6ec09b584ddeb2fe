package org.iceforge.governor.query;

import org.iceforge.governor.cache.CacheEntry;
import org.iceforge.governor.cache.CacheStore;
import org.iceforge.governor.cache.EntryTooLargeException;
import org.iceforge.governor.cache.RemovalCause;
import org.iceforge.governor.quota.QuotaDecision;
import org.iceforge.governor.quota.QuotaExceededException;
import org.iceforge.governor.quota.QuotaLedger;
import org.iceforge.governor.quota.ResourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Function;

/**
 * Read-through access to {@link CacheStore} with quota-checked, single-flight computation.
 * <p>
 * On a miss the first caller for a key leads the computation; later callers for the same key
 * join it and get the same outcome, value or failure. The leader reserves the engine's size
 * estimate on the tenant's {@link ResourceType#CACHE_BYTES} before computing and settles the
 * reservation to the actual size afterwards. Cached bytes stay charged to the tenant until the
 * entry leaves the cache, at which point they are released.
 */
public class CacheFacade {
    private static final Logger log = LoggerFactory.getLogger(CacheFacade.class);

    private final CacheStore store;
    private final QuotaLedger ledger;
    private final ExecutorService computeExecutor;
    private final FacadeOptions options;

    private final ConcurrentHashMap<String, CompletableFuture<byte[]>> inFlight = new ConcurrentHashMap<>();
    private final LongAdder computations = new LongAdder();

    public CacheFacade(CacheStore store, QuotaLedger ledger, ExecutorService computeExecutor, FacadeOptions options) {
        this.store = Objects.requireNonNull(store, "store");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.computeExecutor = Objects.requireNonNull(computeExecutor, "computeExecutor");
        this.options = Objects.requireNonNull(options, "options");
        store.addRemovalListener(this::releaseOwnedBytes);
    }

    /**
     * Blocking variant of {@link #getOrComputeAsync}. Waits at most the configured compute timeout.
     *
     * @throws QuotaExceededException   if the tenant's cache quota denies the result
     * @throws ComputeFailureException  if the engine fails or the result does not arrive in time
     */
    public byte[] getOrCompute(String key, Duration ttl, String tenantId, QueryEngine engine) {
        CompletableFuture<byte[]> result = getOrComputeAsync(key, ttl, tenantId, engine);
        long timeoutMs = options.computeTimeout().toMillis();
        try {
            return result.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw unwrap(key, e.getCause());
        } catch (TimeoutException e) {
            // only this caller's view is cancelled; the shared computation carries on
            result.cancel(false);
            throw new ComputeFailureException(key, "Timed out after " + options.computeTimeout() + " waiting for " + key, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ComputeFailureException(key, "Interrupted waiting for " + key, e);
        }
    }

    /**
     * Returns the cached value or joins/starts its computation. Each call returns its own future,
     * so cancelling it never affects other callers waiting on the same key.
     *
     * @param ttl TTL for the computed entry; {@code null} uses the default
     * @throws IllegalArgumentException if {@code ttl} is zero or negative
     */
    public CompletableFuture<byte[]> getOrComputeAsync(String key, Duration ttl, String tenantId, QueryEngine engine) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(engine, "engine");
        if (ttl != null && (ttl.isZero() || ttl.isNegative())) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        Duration effectiveTtl = ttl == null ? options.defaultTtl() : ttl;

        Optional<byte[]> hit = store.get(key);
        if (hit.isPresent()) {
            return CompletableFuture.completedFuture(hit.get());
        }

        CompletableFuture<byte[]> flight = new CompletableFuture<>();
        CompletableFuture<byte[]> existing = inFlight.putIfAbsent(key, flight);
        if (existing != null) {
            log.debug("Joining in-flight computation for {}", key);
            return existing.thenApply(Function.identity());
        }
        try {
            lead(key, effectiveTtl, tenantId, engine, flight);
        } catch (RuntimeException e) {
            finish(key, flight, null, e);
        }
        return flight.thenApply(Function.identity());
    }

    /** Number of engine invocations so far. */
    public long computations() {
        return computations.sum();
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    public CacheStore store() {
        return store;
    }

    private void lead(String key, Duration ttl, String tenantId, QueryEngine engine, CompletableFuture<byte[]> flight) {
        // another leader may have finished between our miss and our registration
        Optional<byte[]> raced = store.getIfPresent(key);
        if (raced.isPresent()) {
            finish(key, flight, raced.get(), null);
            return;
        }

        long estimate = engine.estimateSize(key);
        if (estimate < 0) estimate = options.defaultEstimateBytes();
        QuotaDecision decision = ledger.reserve(tenantId, ResourceType.CACHE_BYTES, estimate);
        if (!decision.allowed()) {
            finish(key, flight, null, new QuotaExceededException(decision));
            return;
        }

        long reserved = estimate;
        try {
            computeExecutor.execute(() -> compute(key, ttl, tenantId, engine, flight, reserved));
        } catch (RejectedExecutionException e) {
            ledger.release(tenantId, ResourceType.CACHE_BYTES, reserved);
            finish(key, flight, null, new ComputeFailureException(key, "Compute executor rejected " + key, e));
        }
    }

    private void compute(String key, Duration ttl, String tenantId, QueryEngine engine,
                         CompletableFuture<byte[]> flight, long reserved) {
        try {
            ComputedValue computed;
            computations.increment();
            long started = System.nanoTime();
            try {
                computed = Objects.requireNonNull(engine.compute(key), "engine returned no value");
            } catch (Exception e) {
                ledger.release(tenantId, ResourceType.CACHE_BYTES, reserved);
                log.warn("Computation failed for {} (tenant={}): {}", key, tenantId, e.toString());
                finish(key, flight, null, new ComputeFailureException(key, "Failed to compute " + key + ": " + e.getMessage(), e));
                return;
            }
            log.debug("Computed {} in {} ms ({} bytes)", key,
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started), computed.sizeBytes());

            long actual = computed.sizeBytes();
            long delta = actual - reserved;
            if (delta > 0) {
                QuotaDecision extra = ledger.reserve(tenantId, ResourceType.CACHE_BYTES, delta);
                if (!extra.allowed()) {
                    ledger.release(tenantId, ResourceType.CACHE_BYTES, reserved);
                    finish(key, flight, null, new QuotaExceededException(extra));
                    return;
                }
            } else if (delta < 0) {
                ledger.release(tenantId, ResourceType.CACHE_BYTES, -delta);
            }

            try {
                store.put(key, computed.value(), ttl, tenantId, actual);
            } catch (EntryTooLargeException e) {
                ledger.release(tenantId, ResourceType.CACHE_BYTES, actual);
                log.warn("Result for {} returned uncached: {}", key, e.getMessage());
            } catch (RuntimeException e) {
                ledger.release(tenantId, ResourceType.CACHE_BYTES, actual);
                log.warn("Failed to cache {} (tenant={}): {}", key, tenantId, e.toString());
                finish(key, flight, null, new ComputeFailureException(key, "Failed to cache " + key + ": " + e.getMessage(), e));
                return;
            }
            finish(key, flight, computed.value(), null);
        } finally {
            if (!flight.isDone()) {
                finish(key, flight, null, new ComputeFailureException(key, "Computation for " + key + " ended without a result", null));
            }
        }
    }

    private void finish(String key, CompletableFuture<byte[]> flight, byte[] value, RuntimeException failure) {
        // unregister first so a caller arriving after completion starts fresh instead of joining a done flight
        inFlight.remove(key, flight);
        if (failure != null) {
            flight.completeExceptionally(failure);
        } else {
            flight.complete(value);
        }
    }

    private void releaseOwnedBytes(CacheEntry entry, RemovalCause cause) {
        if (entry.ownerTenant() == null || entry.sizeBytes() == 0) return;
        ledger.release(entry.ownerTenant(), ResourceType.CACHE_BYTES, entry.sizeBytes());
        log.debug("Released {} cache bytes for tenant {} ({} {})", entry.sizeBytes(), entry.ownerTenant(), entry.key(), cause);
    }

    private static RuntimeException unwrap(String key, Throwable cause) {
        Throwable t = cause;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        if (t instanceof RuntimeException re) return re;
        return new ComputeFailureException(key, "Failed to compute " + key, t);
    }
}
