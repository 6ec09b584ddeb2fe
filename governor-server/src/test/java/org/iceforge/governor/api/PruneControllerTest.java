package org.iceforge.governor.api;

import org.iceforge.governor.retention.PruneStats;
import org.iceforge.governor.retention.RetentionScheduler;
import org.iceforge.governor.retention.SchedulerState;
import org.iceforge.governor.retention.SchedulerStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PruneControllerTest {

    private RetentionScheduler scheduler;
    private PruneController controller;

    @BeforeEach
    void setUp() {
        scheduler = mock(RetentionScheduler.class);
        controller = new PruneController(scheduler);
    }

    @Test
    void run_returnsCycleStats() {
        PruneStats stats = PruneStats.builder(Instant.parse("2024-03-01T00:00:00Z")).jobDeleted().build();
        when(scheduler.runNow()).thenReturn(Optional.of(stats));

        ResponseEntity<?> resp = controller.run();

        assertEquals(HttpStatus.OK, resp.getStatusCode());
        assertSame(stats, resp.getBody());
    }

    @Test
    void run_whileCycleInProgress_returns409() {
        when(scheduler.runNow()).thenReturn(Optional.empty());
        when(scheduler.status()).thenReturn(status(SchedulerState.RUNNING));

        assertEquals(HttpStatus.CONFLICT, controller.run().getStatusCode());
    }

    @Test
    void run_afterStop_returns503() {
        when(scheduler.runNow()).thenReturn(Optional.empty());
        when(scheduler.status()).thenReturn(status(SchedulerState.STOPPED));

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, controller.run().getStatusCode());
    }

    @Test
    void history_delegatesToScheduler() {
        PruneStats stats = PruneStats.builder(Instant.parse("2024-03-01T00:00:00Z")).build();
        when(scheduler.history()).thenReturn(List.of(stats));

        assertEquals(List.of(stats), controller.history());
        verify(scheduler, times(1)).history();
    }

    private static SchedulerStatus status(SchedulerState state) {
        return new SchedulerStatus(true, state, Duration.ofHours(1), null, null, 0, 0, 0);
    }
}
