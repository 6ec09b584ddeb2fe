package org.iceforge.governor.retention;

import java.time.Duration;
import java.util.Objects;

/**
 * Retention rules and scheduling knobs for one {@link RetentionScheduler}.
 *
 * @param maxArtifactsPerTenant artifact count cap per tenant; 0 disables the cap
 * @param batchSize             deletions performed between two cancellation checks
 * @param historySize           number of past cycle results kept for reporting
 * @param shutdownGrace         how long {@code stop()} waits for an in-flight batch
 */
public record PruneConfig(boolean enabled,
                          Duration interval,
                          Duration maxJobAge,
                          Duration maxArtifactAge,
                          int maxArtifactsPerTenant,
                          int batchSize,
                          boolean dryRun,
                          int historySize,
                          Duration shutdownGrace) {

    public static PruneConfig defaults() {
        return new PruneConfig(true, Duration.ofHours(1), Duration.ofDays(30), Duration.ofDays(30),
                1000, 100, false, 20, Duration.ofSeconds(30));
    }

    /**
     * @throws IllegalArgumentException naming the first invalid setting
     */
    public PruneConfig validate() {
        requirePositive("interval", interval);
        requireNonNegative("maxJobAge", maxJobAge);
        requireNonNegative("maxArtifactAge", maxArtifactAge);
        requireNonNegative("shutdownGrace", shutdownGrace);
        if (maxArtifactsPerTenant < 0) {
            throw new IllegalArgumentException("maxArtifactsPerTenant must be >= 0: " + maxArtifactsPerTenant);
        }
        if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be > 0: " + batchSize);
        if (historySize <= 0) throw new IllegalArgumentException("historySize must be > 0: " + historySize);
        return this;
    }

    public PruneConfig withDryRun(boolean value) {
        return new PruneConfig(enabled, interval, maxJobAge, maxArtifactAge, maxArtifactsPerTenant, batchSize,
                value, historySize, shutdownGrace);
    }

    public PruneConfig withEnabled(boolean value) {
        return new PruneConfig(value, interval, maxJobAge, maxArtifactAge, maxArtifactsPerTenant, batchSize,
                dryRun, historySize, shutdownGrace);
    }

    private static void requirePositive(String name, Duration d) {
        Objects.requireNonNull(d, name);
        if (d.isZero() || d.isNegative()) throw new IllegalArgumentException(name + " must be positive: " + d);
    }

    private static void requireNonNegative(String name, Duration d) {
        Objects.requireNonNull(d, name);
        if (d.isNegative()) throw new IllegalArgumentException(name + " must not be negative: " + d);
    }
}
