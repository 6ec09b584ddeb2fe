package org.iceforge.governor.query;

import java.time.Duration;
import java.util.Objects;

/**
 * @param defaultTtl           TTL used when a caller passes none
 * @param defaultEstimateBytes reservation made when the engine cannot estimate its result size
 * @param computeTimeout       how long a blocking caller waits for the result
 */
public record FacadeOptions(Duration defaultTtl, long defaultEstimateBytes, Duration computeTimeout) {

    public FacadeOptions {
        Objects.requireNonNull(defaultTtl, "defaultTtl");
        Objects.requireNonNull(computeTimeout, "computeTimeout");
        if (defaultTtl.isZero() || defaultTtl.isNegative()) {
            throw new IllegalArgumentException("defaultTtl must be positive: " + defaultTtl);
        }
        if (computeTimeout.isZero() || computeTimeout.isNegative()) {
            throw new IllegalArgumentException("computeTimeout must be positive: " + computeTimeout);
        }
        if (defaultEstimateBytes < 0) {
            throw new IllegalArgumentException("defaultEstimateBytes must be >= 0: " + defaultEstimateBytes);
        }
    }

    public static FacadeOptions defaults() {
        return new FacadeOptions(Duration.ofMinutes(5), 64L * 1024, Duration.ofSeconds(60));
    }
}
