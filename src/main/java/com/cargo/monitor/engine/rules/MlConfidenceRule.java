package com.cargo.monitor.engine.rules;

import com.cargo.monitor.config.MonitorConfig;
import com.cargo.monitor.engine.EvaluationContext;
import com.cargo.monitor.engine.ExceptionRule;
import com.cargo.monitor.model.ExceptionFinding;
import com.cargo.monitor.model.ExceptionType;
import com.cargo.monitor.model.FindingDetails;
import com.cargo.monitor.model.Severity;
import com.cargo.monitor.model.ShipmentSnapshot;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Flags shipments the delay classifier is confident about.
 *
 * Logic: fires when mlDelayConfidence is strictly greater than the shared confidence
 * threshold (0.70). Exactly 0.70 does not fire. HIGH above 0.85, otherwise MEDIUM.
 * Risk factors are copied in classifier order.
 */
@Component
@Order(2)
public class MlConfidenceRule implements ExceptionRule {

    private final MonitorConfig config;

    public MlConfidenceRule(MonitorConfig config) {
        this.config = config;
    }

    @Override
    public ExceptionType getSupportedType() {
        return ExceptionType.ML_PREDICTION;
    }

    @Override
    public Optional<ExceptionFinding> evaluate(ShipmentSnapshot snapshot, EvaluationContext context) {
        double confidence = snapshot.getMlDelayConfidence();
        if (!exceedsThreshold(confidence)) {
            return Optional.empty();
        }

        Severity severity = confidence > config.getThresholds().getMlConfidenceHigh()
                ? Severity.HIGH : Severity.MEDIUM;

        List<String> riskFactors = snapshot.getMlRiskFactors() == null
                ? List.of() : List.copyOf(snapshot.getMlRiskFactors());

        FindingDetails details = FindingDetails.builder()
                .message(String.format("ML predicts delay with %.0f%% confidence", confidence * 100))
                .mlConfidence(confidence)
                .riskFactors(riskFactors)
                .predictedDelayHours(snapshot.getPredictedDelayHours().orElse(null))
                .build();

        return Optional.of(ExceptionFinding.builder()
                .shipmentId(snapshot.getShipmentId())
                .type(ExceptionType.ML_PREDICTION)
                .severity(severity)
                .details(details)
                .detectedAt(context.getNow())
                .build());
    }

    /**
     * Strict comparison against the shared confidence threshold.
     * The proactive warning gate calls this so both paths agree on the boundary.
     */
    public boolean exceedsThreshold(double confidence) {
        return confidence > config.getThresholds().getMlConfidence();
    }

    public double getThreshold() {
        return config.getThresholds().getMlConfidence();
    }
}
