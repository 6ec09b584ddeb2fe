package org.iceforge.governor.retention;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of one retention cycle. In a dry run only the {@code *Matched} counters are filled.
 */
public record PruneStats(int jobsDeleted,
                         int artifactsDeleted,
                         long bytesFreed,
                         int jobsMatched,
                         int artifactsMatched,
                         long bytesMatched,
                         int cacheEntriesExpired,
                         Duration duration,
                         List<String> errors,
                         Instant timestamp,
                         boolean dryRun,
                         boolean aborted) {

    public PruneStats {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public double bytesFreedMb() {
        return bytesFreed / (1024.0d * 1024.0d);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public static Builder builder(Instant timestamp) {
        return new Builder(timestamp);
    }

    public static final class Builder {
        private final Instant timestamp;
        private int jobsDeleted;
        private int artifactsDeleted;
        private long bytesFreed;
        private int jobsMatched;
        private int artifactsMatched;
        private long bytesMatched;
        private int cacheEntriesExpired;
        private Duration duration = Duration.ZERO;
        private final List<String> errors = new ArrayList<>();
        private boolean dryRun;
        private boolean aborted;

        private Builder(Instant timestamp) {
            this.timestamp = timestamp;
        }

        public Builder jobDeleted() { jobsDeleted++; return this; }

        public Builder artifactDeleted(long bytes) {
            artifactsDeleted++;
            bytesFreed += bytes;
            return this;
        }

        public Builder jobMatched() { jobsMatched++; return this; }

        public Builder artifactMatched(long bytes) {
            artifactsMatched++;
            bytesMatched += bytes;
            return this;
        }

        public Builder cacheEntriesExpired(int n) { cacheEntriesExpired = n; return this; }
        public Builder duration(Duration d) { duration = d; return this; }
        public Builder error(String message) { errors.add(message); return this; }
        public Builder dryRun(boolean v) { dryRun = v; return this; }
        public Builder aborted(boolean v) { aborted = v; return this; }

        public PruneStats build() {
            return new PruneStats(jobsDeleted, artifactsDeleted, bytesFreed, jobsMatched, artifactsMatched, bytesMatched,
                    cacheEntriesExpired, duration, errors, timestamp, dryRun, aborted);
        }
    }
}
