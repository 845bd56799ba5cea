package com.cargo.monitor.engine.rules;

import com.cargo.monitor.config.MonitorConfig;
import com.cargo.monitor.engine.EvaluationContext;
import com.cargo.monitor.engine.ExceptionRule;
import com.cargo.monitor.model.ExceptionFinding;
import com.cargo.monitor.model.ExceptionType;
import com.cargo.monitor.model.FindingDetails;
import com.cargo.monitor.model.ReeferTelemetry;
import com.cargo.monitor.model.Severity;
import com.cargo.monitor.model.ShipmentSnapshot;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Detects reefer containers drifting off their setpoint.
 *
 * Logic: only applies when telemetry is present. Fires when
 * |temperature - setpoint| > 5.0°C. HIGH above 10.0°C, otherwise MEDIUM.
 */
@Component
@Order(3)
public class TemperatureDeviationRule implements ExceptionRule {

    private final MonitorConfig config;

    public TemperatureDeviationRule(MonitorConfig config) {
        this.config = config;
    }

    @Override
    public ExceptionType getSupportedType() {
        return ExceptionType.TEMPERATURE_DEVIATION;
    }

    @Override
    public Optional<ExceptionFinding> evaluate(ShipmentSnapshot snapshot, EvaluationContext context) {
        Optional<ReeferTelemetry> telemetry = snapshot.getReeferTelemetry();
        if (telemetry.isEmpty()) {
            return Optional.empty();
        }

        ReeferTelemetry reading = telemetry.get();
        MonitorConfig.Thresholds thresholds = config.getThresholds();
        double deviation = reading.deviationCelsius();
        if (deviation <= thresholds.getTemperatureDeviationCelsius()) {
            return Optional.empty();
        }

        Severity severity = deviation > thresholds.getTemperatureDeviationHighCelsius()
                ? Severity.HIGH : Severity.MEDIUM;

        String container = reading.getContainerId() != null ? reading.getContainerId() : "reefer";
        FindingDetails details = FindingDetails.builder()
                .message(String.format("Container %s temperature deviation: %.1f°C", container, deviation))
                .containerId(reading.getContainerId())
                .temperatureCelsius(reading.getTemperatureCelsius())
                .setpointCelsius(reading.getSetpointCelsius())
                .deviationCelsius(deviation)
                .build();

        return Optional.of(ExceptionFinding.builder()
                .shipmentId(snapshot.getShipmentId())
                .type(ExceptionType.TEMPERATURE_DEVIATION)
                .severity(severity)
                .details(details)
                .detectedAt(context.getNow())
                .build());
    }
}
