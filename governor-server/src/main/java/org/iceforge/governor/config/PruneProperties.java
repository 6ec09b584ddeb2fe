package org.iceforge.governor.config;

import org.iceforge.governor.retention.PruneConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Retention pruning schedule and rules.
 */
@ConfigurationProperties(prefix = "governor.prune")
public class PruneProperties {

    private boolean enabled = true;

    /** Delay between the end of one cycle and the start of the next. */
    private Duration interval = Duration.ofHours(1);

    /** Finished jobs older than this are deleted together with their artifacts. */
    private Duration maxJobAge = Duration.ofDays(30);

    private Duration maxArtifactAge = Duration.ofDays(30);

    /** Oldest artifacts beyond this count are deleted per tenant. 0 disables the cap. */
    private int maxArtifactsPerTenant = 1000;

    /** Deletions between two cancellation checks. */
    private int batchSize = 100;

    /** Log what would be deleted without deleting anything. */
    private boolean dryRun = false;

    /** Number of past cycles kept for /api/prune/history. */
    private int historySize = 20;

    /** How long shutdown waits for a running cycle. */
    private Duration shutdownGrace = Duration.ofSeconds(30);

    public PruneConfig toConfig() {
        return new PruneConfig(enabled, interval, maxJobAge, maxArtifactAge, maxArtifactsPerTenant, batchSize,
                dryRun, historySize, shutdownGrace);
    }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public Duration getInterval() { return interval; }
    public void setInterval(Duration interval) { this.interval = interval; }

    public Duration getMaxJobAge() { return maxJobAge; }
    public void setMaxJobAge(Duration maxJobAge) { this.maxJobAge = maxJobAge; }

    public Duration getMaxArtifactAge() { return maxArtifactAge; }
    public void setMaxArtifactAge(Duration maxArtifactAge) { this.maxArtifactAge = maxArtifactAge; }

    public int getMaxArtifactsPerTenant() { return maxArtifactsPerTenant; }
    public void setMaxArtifactsPerTenant(int maxArtifactsPerTenant) { this.maxArtifactsPerTenant = maxArtifactsPerTenant; }

    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

    public boolean isDryRun() { return dryRun; }
    public void setDryRun(boolean dryRun) { this.dryRun = dryRun; }

    public int getHistorySize() { return historySize; }
    public void setHistorySize(int historySize) { this.historySize = historySize; }

    public Duration getShutdownGrace() { return shutdownGrace; }
    public void setShutdownGrace(Duration shutdownGrace) { this.shutdownGrace = shutdownGrace; }
}
