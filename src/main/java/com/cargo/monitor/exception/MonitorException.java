package com.cargo.monitor.exception;

/**
 * Root of the monitor's failure taxonomy. Each subtype is isolated to the smallest unit that failed.
 */
public class MonitorException extends RuntimeException {

    public MonitorException(String message) {
        super(message);
    }

    public MonitorException(String message, Throwable cause) {
        super(message, cause);
    }
}
