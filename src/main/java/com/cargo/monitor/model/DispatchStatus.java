package com.cargo.monitor.model;

public enum DispatchStatus {
    /** Handler accepted the message. */
    SENT,
    /** Handler answered with a well-formed rejection; not retried. */
    REJECTED,
    /** Transport failed on every allowed attempt. */
    FAILED,
    /** Cycle deadline passed before an attempt could start. */
    ABANDONED,
    /** Cancellation observed before the dispatch began. */
    SKIPPED;

    public boolean isSuccess() {
        return this == SENT;
    }
}
