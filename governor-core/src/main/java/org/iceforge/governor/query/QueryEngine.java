package org.iceforge.governor.query;

/**
 * Produces the value for a cache key on a miss.
 */
@FunctionalInterface
public interface QueryEngine {

    ComputedValue compute(String key) throws Exception;

    /**
     * Expected result size, reserved against the tenant's cache quota before computing.
     * A negative value means unknown; the facade then uses its configured default.
     */
    default long estimateSize(String key) {
        return -1L;
    }
}
