package com.cargo.monitor.engine.rules;

import com.cargo.monitor.config.MonitorConfig;
import com.cargo.monitor.engine.Durations;
import com.cargo.monitor.engine.EvaluationContext;
import com.cargo.monitor.engine.ExceptionRule;
import com.cargo.monitor.model.ExceptionFinding;
import com.cargo.monitor.model.ExceptionType;
import com.cargo.monitor.model.FindingDetails;
import com.cargo.monitor.model.Severity;
import com.cargo.monitor.model.ShipmentSnapshot;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Detects ETA slippage.
 *
 * Logic: delay = currentEtaEstimate - scheduledEta. Fires when the delay is strictly
 * greater than the configured threshold (24h by default). Severity is HIGH when the
 * delay also exceeds the high cut (48h), otherwise MEDIUM.
 *
 * Example: scheduled T, estimate T+30h gives a MEDIUM finding; T+49h gives HIGH.
 */
@Component
@Order(1)
public class DelayThresholdRule implements ExceptionRule {

    private final MonitorConfig config;

    public DelayThresholdRule(MonitorConfig config) {
        this.config = config;
    }

    @Override
    public ExceptionType getSupportedType() {
        return ExceptionType.DELAY;
    }

    @Override
    public Optional<ExceptionFinding> evaluate(ShipmentSnapshot snapshot, EvaluationContext context) {
        if (snapshot.getScheduledEta() == null || snapshot.getCurrentEtaEstimate() == null) {
            return Optional.empty();
        }

        MonitorConfig.Thresholds thresholds = config.getThresholds();
        double delayHours = Durations.hours(snapshot.etaDelay());
        if (delayHours <= thresholds.getDelayHours()) {
            return Optional.empty();
        }

        Severity severity = delayHours > thresholds.getDelayHighHours() ? Severity.HIGH : Severity.MEDIUM;

        FindingDetails details = FindingDetails.builder()
                .message(String.format("Shipment delayed by %.1f hours (threshold: %.0fh)",
                        delayHours, thresholds.getDelayHours()))
                .delayHours(delayHours)
                .thresholdHours(thresholds.getDelayHours())
                .build();

        return Optional.of(ExceptionFinding.builder()
                .shipmentId(snapshot.getShipmentId())
                .type(ExceptionType.DELAY)
                .severity(severity)
                .details(details)
                .detectedAt(context.getNow())
                .build());
    }
}
