package com.cargo.monitor.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
@Schema(description = "One rule's detected exception for one shipment in one run")
public class ExceptionFinding {

    @Schema(example = "SHP-2024-001")
    String shipmentId;

    @Schema(example = "delay")
    ExceptionType type;

    @Schema(example = "medium")
    Severity severity;

    FindingDetails details;

    Instant detectedAt;
}
