package com.cargo.monitor.exception;

/**
 * Outbound call to the exception handler failed. Transient failures (timeouts, connection
 * errors, 5xx) qualify for a retry; rejections (4xx) do not.
 */
public class DispatchTransportException extends MonitorException {

    private final boolean transientFailure;
    private final Integer httpStatus;

    public DispatchTransportException(String message, boolean transientFailure, Integer httpStatus, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
        this.httpStatus = httpStatus;
    }

    public static DispatchTransportException rejected(int httpStatus, String body) {
        return new DispatchTransportException(
                "Exception handler rejected message with status " + httpStatus + ": " + body,
                false, httpStatus, null);
    }

    public static DispatchTransportException serverError(int httpStatus, Throwable cause) {
        return new DispatchTransportException(
                "Exception handler returned status " + httpStatus, true, httpStatus, cause);
    }

    public static DispatchTransportException io(Throwable cause) {
        return new DispatchTransportException(
                "Exception handler unreachable: " + cause.getMessage(), true, null, cause);
    }

    public boolean isTransient() {
        return transientFailure;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }
}
