package org.iceforge.governor.retention;

public enum SchedulerState {
    IDLE,
    RUNNING,
    STOPPED
}
