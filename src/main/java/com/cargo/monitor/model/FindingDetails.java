package com.cargo.monitor.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Human-readable evidence attached to a finding. Each rule fills only the fields it owns.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Evidence backing an exception finding")
public class FindingDetails {

    @Schema(example = "Shipment delayed by 30.0 hours (threshold: 24h)")
    String message;

    // delay
    Double delayHours;
    Double thresholdHours;

    // ml_prediction
    Double mlConfidence;
    List<String> riskFactors;
    Double predictedDelayHours;

    // temperature_deviation
    String containerId;
    Double temperatureCelsius;
    Double setpointCelsius;
    Double deviationCelsius;

    // geofence_violation
    Double latitude;
    Double longitude;

    // missing_milestone
    Double hoursSinceMilestone;
    String milestoneName;
}
