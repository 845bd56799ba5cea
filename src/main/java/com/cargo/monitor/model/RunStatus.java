package com.cargo.monitor.model;

public enum RunStatus {
    COMPLETED,
    SNAPSHOT_UNAVAILABLE,
    DEADLINE_EXCEEDED,
    CANCELLED
}
