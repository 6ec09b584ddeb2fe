package org.iceforge.governor.retention;

import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Ties the retention scheduler to the application context: ticks start once the context is
 * refreshed and stop, with the configured grace period, on shutdown.
 */
@Component
public class RetentionSchedulerLifecycle implements SmartLifecycle {

    private final RetentionScheduler scheduler;
    private volatile boolean running;

    public RetentionSchedulerLifecycle(RetentionScheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    @Override
    public void start() {
        scheduler.start();
        running = true;
    }

    @Override
    public void stop() {
        running = false;
        scheduler.stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return 0;
    }
}
