package com.cargo.monitor.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DispatchOutcome {

    String notificationId;

    String shipmentId;

    ExceptionType type;

    Severity severity;

    DispatchStatus status;

    int attempts;

    Integer httpStatus;

    String error;
}
