package com.cargo.monitor.exception;

/**
 * The snapshot provider could not read the active shipment set. Aborts the whole cycle.
 */
public class SnapshotUnavailableException extends MonitorException {

    public SnapshotUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
