package com.cargo.monitor.exception;

public class PersistenceException extends MonitorException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
