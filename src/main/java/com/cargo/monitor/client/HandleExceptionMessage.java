package com.cargo.monitor.client;

import com.cargo.monitor.model.ExceptionType;
import com.cargo.monitor.model.FindingDetails;
import com.cargo.monitor.model.Severity;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of the {@code message:send} call to the exception-handling agent.
 */
public record HandleExceptionMessage(
        String skill,
        String crew,
        ExceptionType type,
        Severity severity,
        @JsonProperty("shipment_id") String shipmentId,
        @JsonProperty("notification_id") String notificationId,
        String subject,
        String message,
        FindingDetails details) {}
