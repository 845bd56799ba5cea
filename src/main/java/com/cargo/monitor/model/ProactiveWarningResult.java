package com.cargo.monitor.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Outcome of the proactive delay-warning gate")
public class ProactiveWarningResult {

    boolean success;

    String shipmentId;

    boolean warningSent;

    @Schema(description = "Confidence the classifier reported", example = "0.62")
    Double mlConfidence;

    @Schema(description = "Threshold confidence had to exceed", example = "0.7")
    Double threshold;

    @Schema(example = "Confidence 62.0% not above threshold 70%")
    String reason;

    List<String> riskFactors;

    Double predictedDelayHours;

    String notificationId;

    String error;
}
