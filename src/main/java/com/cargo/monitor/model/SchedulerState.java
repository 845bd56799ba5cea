package com.cargo.monitor.model;

public enum SchedulerState {
    IDLE,
    RUNNING,
    STOPPING,
    STOPPED
}
