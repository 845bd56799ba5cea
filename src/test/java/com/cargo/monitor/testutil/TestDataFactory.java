package com.cargo.monitor.testutil;

import com.cargo.monitor.config.MonitorConfig;
import com.cargo.monitor.model.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    public static final Instant NOW = Instant.parse("2024-03-15T12:00:00Z");

    private TestDataFactory() {}

    public static MonitorConfig defaultConfig() {
        return new MonitorConfig();
    }

    /** A shipment that trips no rule at {@link #NOW}. */
    public static ShipmentSnapshot.ShipmentSnapshotBuilder quietShipment(String shipmentId) {
        return ShipmentSnapshot.builder()
                .shipmentId(shipmentId)
                .scheduledEta(NOW.plus(Duration.ofDays(3)))
                .currentEtaEstimate(NOW.plus(Duration.ofDays(3)))
                .mlDelayConfidence(0.10)
                .lastMilestoneAt(NOW.minus(Duration.ofHours(6)))
                .lastMilestoneName("Departed Shanghai");
    }

    public static ShipmentSnapshot delayedShipment(String shipmentId, long delayHours) {
        return quietShipment(shipmentId)
                .currentEtaEstimate(NOW.plus(Duration.ofDays(3)).plus(Duration.ofHours(delayHours)))
                .build();
    }

    public static ShipmentSnapshot mlFlaggedShipment(String shipmentId, double confidence) {
        return quietShipment(shipmentId)
                .mlDelayConfidence(confidence)
                .mlRiskFactor("port_congestion")
                .mlRiskFactor("weather")
                .predictedDelayHours(36.0)
                .build();
    }

    public static ShipmentSnapshot reeferShipment(String shipmentId, double temperature, double setpoint) {
        return quietShipment(shipmentId)
                .reeferTelemetry(ReeferTelemetry.builder()
                        .containerId("MSCU1234567")
                        .temperatureCelsius(temperature)
                        .setpointCelsius(setpoint)
                        .build())
                .build();
    }

    public static ShipmentSnapshot positionedShipment(String shipmentId, double lat, double lon) {
        return quietShipment(shipmentId)
                .currentPosition(new GeoPoint(lat, lon))
                .expectedRouteCorridor(squareCorridor())
                .build();
    }

    public static ShipmentSnapshot silentShipment(String shipmentId, long hoursSinceMilestone) {
        return quietShipment(shipmentId)
                .lastMilestoneAt(NOW.minus(Duration.ofHours(hoursSinceMilestone)))
                .build();
    }

    /** Corridor covering lat 0..10, lon 0..10. */
    public static RouteCorridor squareCorridor() {
        return new RouteCorridor(List.of(
                new GeoPoint(0, 0),
                new GeoPoint(0, 10),
                new GeoPoint(10, 10),
                new GeoPoint(10, 0)));
    }

    public static ExceptionFinding createFinding(String shipmentId, ExceptionType type, Severity severity) {
        return ExceptionFinding.builder()
                .shipmentId(shipmentId)
                .type(type)
                .severity(severity)
                .details(FindingDetails.builder()
                        .message("Test " + type.getWireName() + " for " + shipmentId)
                        .build())
                .detectedAt(NOW)
                .build();
    }

    public static MonitorRunRecord createRunRecord(String runId, Instant timestamp, int checked, int found, int sent) {
        return MonitorRunRecord.builder()
                .runId(runId)
                .runTimestamp(timestamp)
                .shipmentsChecked(checked)
                .exceptionsFound(found)
                .notificationsSent(sent)
                .dispatchFailures(found - sent)
                .runDurationMs(120)
                .status(RunStatus.COMPLETED)
                .build();
    }

    public static NotificationRecord createNotificationRecord(String notificationId, String shipmentId, String type) {
        return NotificationRecord.builder()
                .notificationId(notificationId)
                .shipmentId(shipmentId)
                .type(type)
                .sentAt(NOW)
                .channels(Set.of(NotificationChannel.EMAIL))
                .delivered(true)
                .language(Language.EN)
                .messagePreview("Shipment " + shipmentId)
                .trackingUrl("https://track.cwlogistics.com/" + shipmentId)
                .build();
    }
}
