package com.cargo.monitor.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Point-in-time view of one active shipment. Every rule reads from this and nothing else.
 */
@Value
@Builder
@Schema(description = "Immutable snapshot of an in-flight shipment")
public class ShipmentSnapshot {

    @Schema(description = "Stable shipment identifier", example = "SHP-2024-001")
    String shipmentId;

    Instant scheduledEta;

    Instant currentEtaEstimate;

    @Schema(description = "Classifier probability that the shipment will be delayed", example = "0.82")
    double mlDelayConfidence;

    @Singular
    List<String> mlRiskFactors;

    Double predictedDelayHours;

    ReeferTelemetry reeferTelemetry;

    GeoPoint currentPosition;

    RouteCorridor expectedRouteCorridor;

    Instant lastMilestoneAt;

    String lastMilestoneName;

    Duration expectedMilestoneInterval;

    public Optional<ReeferTelemetry> getReeferTelemetry() {
        return Optional.ofNullable(reeferTelemetry);
    }

    public Optional<GeoPoint> getCurrentPosition() {
        return Optional.ofNullable(currentPosition);
    }

    public Optional<RouteCorridor> getExpectedRouteCorridor() {
        return Optional.ofNullable(expectedRouteCorridor);
    }

    public Optional<Double> getPredictedDelayHours() {
        return Optional.ofNullable(predictedDelayHours);
    }

    public Duration etaDelay() {
        return Duration.between(scheduledEta, currentEtaEstimate);
    }
}
