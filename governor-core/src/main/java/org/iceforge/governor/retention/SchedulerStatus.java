package org.iceforge.governor.retention;

import java.time.Duration;
import java.time.Instant;

public record SchedulerStatus(boolean enabled,
                              SchedulerState state,
                              Duration interval,
                              Instant lastRunAt,
                              PruneStats lastStats,
                              long cyclesCompleted,
                              long cyclesSkipped,
                              long cyclesFailed) {
}
