package org.iceforge.governor.api;

import org.iceforge.governor.retention.PruneStats;
import org.iceforge.governor.retention.RetentionScheduler;
import org.iceforge.governor.retention.SchedulerState;
import org.iceforge.governor.retention.SchedulerStatus;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@RestController
@RequestMapping("/api/prune")
public class PruneController {

    private final RetentionScheduler scheduler;

    public PruneController(RetentionScheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler);
    }

    @GetMapping("/status")
    public SchedulerStatus status() {
        return scheduler.status();
    }

    @GetMapping("/history")
    public List<PruneStats> history() {
        return scheduler.history();
    }

    /**
     * Runs a cycle now on the request thread. 409 if one is already running.
     */
    @PostMapping("/run")
    public ResponseEntity<?> run() {
        Optional<PruneStats> stats = scheduler.runNow();
        if (stats.isPresent()) {
            return ResponseEntity.ok(stats.get());
        }
        if (scheduler.status().state() == SchedulerState.STOPPED) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", "stopped", "message", "Retention scheduler is stopped"));
        }
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Map.of("error", "busy", "message", "A retention cycle is already running"));
    }
}
