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
 * Detects shipments that have gone quiet.
 *
 * Logic: fires when now - lastMilestoneAt exceeds 72h. Always LOW.
 */
@Component
@Order(5)
public class MissingMilestoneRule implements ExceptionRule {

    private final MonitorConfig config;

    public MissingMilestoneRule(MonitorConfig config) {
        this.config = config;
    }

    @Override
    public ExceptionType getSupportedType() {
        return ExceptionType.MISSING_MILESTONE;
    }

    @Override
    public Optional<ExceptionFinding> evaluate(ShipmentSnapshot snapshot, EvaluationContext context) {
        if (snapshot.getLastMilestoneAt() == null) {
            return Optional.empty();
        }

        double threshold = config.getThresholds().getMissingMilestoneHours();
        double hoursSince = Durations.hoursBetween(snapshot.getLastMilestoneAt(), context.getNow());
        if (hoursSince <= threshold) {
            return Optional.empty();
        }

        String milestone = snapshot.getLastMilestoneName() != null ? snapshot.getLastMilestoneName() : "last milestone";
        FindingDetails details = FindingDetails.builder()
                .message(String.format("No milestone since '%s' for %.0f hours (threshold: %.0fh)",
                        milestone, hoursSince, threshold))
                .hoursSinceMilestone(hoursSince)
                .milestoneName(snapshot.getLastMilestoneName())
                .thresholdHours(threshold)
                .build();

        return Optional.of(ExceptionFinding.builder()
                .shipmentId(snapshot.getShipmentId())
                .type(ExceptionType.MISSING_MILESTONE)
                .severity(Severity.LOW)
                .details(details)
                .detectedAt(context.getNow())
                .build());
    }
}
