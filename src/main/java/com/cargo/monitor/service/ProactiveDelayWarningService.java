package com.cargo.monitor.service;

import com.cargo.monitor.engine.rules.MlConfidenceRule;
import com.cargo.monitor.ml.DelayClassifier;
import com.cargo.monitor.model.DelayPrediction;
import com.cargo.monitor.model.NotificationKind;
import com.cargo.monitor.model.NotificationRecord;
import com.cargo.monitor.model.ProactiveWarningRequest;
import com.cargo.monitor.model.ProactiveWarningResult;
import com.cargo.monitor.model.StatusUpdateRequest;
import com.cargo.monitor.notification.CustomerNotificationService;
import com.cargo.monitor.notification.NotificationTransport;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * On-demand, single-shipment form of the ML-confidence rule: warn the customer about a
 * likely delay only when the classifier's confidence is strictly above the threshold the
 * periodic monitor uses.
 */
@Service
public class ProactiveDelayWarningService {

    private static final Logger log = LoggerFactory.getLogger(ProactiveDelayWarningService.class);

    static final String ACTION_RECOMMENDED =
            "Please contact your logistics coordinator for alternative routing options";

    private final DelayClassifier classifier;
    private final MlConfidenceRule confidenceRule;
    private final CustomerNotificationService notificationService;

    public ProactiveDelayWarningService(DelayClassifier classifier,
                                        MlConfidenceRule confidenceRule,
                                        CustomerNotificationService notificationService) {
        this.classifier = classifier;
        this.confidenceRule = confidenceRule;
        this.notificationService = notificationService;
    }

    @Observed(name = "notification.proactive_warning", contextualName = "proactive-delay-warning")
    public ProactiveWarningResult warn(ProactiveWarningRequest request) {
        String shipmentId = request.getShipmentId();
        if (shipmentId == null || shipmentId.isBlank()) {
            throw new IllegalArgumentException("shipmentId is required");
        }
        log.info("Proactive delay warning check for shipment: {}", shipmentId);

        Optional<DelayPrediction> prediction = request.getPrediction() != null
                ? Optional.of(request.getPrediction())
                : classifier.predict(shipmentId);

        if (prediction.isEmpty()) {
            log.warn("No ML prediction data available for {}, skipping", shipmentId);
            return ProactiveWarningResult.builder()
                    .success(false)
                    .shipmentId(shipmentId)
                    .warningSent(false)
                    .threshold(confidenceRule.getThreshold())
                    .reason("No ML prediction data available")
                    .build();
        }

        DelayPrediction p = prediction.get();
        double confidence = p.getConfidence();
        double threshold = confidenceRule.getThreshold();

        if (!p.isWillDelay() || !confidenceRule.exceedsThreshold(confidence)) {
            String reason = p.isWillDelay()
                    ? String.format("Confidence %.1f%% not above threshold %.0f%%", confidence * 100, threshold * 100)
                    : "Classifier does not predict a delay";
            log.info("No proactive warning needed for {}: willDelay={}, confidence={}",
                    shipmentId, p.isWillDelay(), confidence);
            return ProactiveWarningResult.builder()
                    .success(true)
                    .shipmentId(shipmentId)
                    .warningSent(false)
                    .mlConfidence(confidence)
                    .threshold(threshold)
                    .reason(reason)
                    .build();
        }

        List<String> riskFactors = p.getRiskFactors() != null ? p.getRiskFactors() : List.of();
        Map<String, String> additionalData = new HashMap<>();
        additionalData.put("ml_confidence", String.format("%.1f%%", confidence * 100));
        additionalData.put("risk_factors", riskFactors.isEmpty() ? "Multiple factors" : String.join(", ", riskFactors));
        additionalData.put("predicted_delay", p.getPredictedDelayHours() > 0
                ? String.format("%.0f hours", p.getPredictedDelayHours()) : "significant delay");
        additionalData.put("delay_reason", "Predicted by delay risk model");
        additionalData.put("action_recommended", ACTION_RECOMMENDED);

        try {
            NotificationRecord sent = notificationService.sendStatusUpdate(StatusUpdateRequest.builder()
                    .shipmentId(shipmentId)
                    .notificationType(NotificationKind.DELAYED.getCode())
                    .recipientEmail(request.getRecipientEmail())
                    .recipientPhone(request.getRecipientPhone())
                    .language(request.getLanguage())
                    .additionalData(additionalData)
                    .build());

            if (!sent.isDelivered()) {
                NotificationTransport.Recipient recipient =
                        new NotificationTransport.Recipient(request.getRecipientEmail(), request.getRecipientPhone());
                String reason = !recipient.hasEmail() && !recipient.hasPhone()
                        ? "No recipient email or phone provided"
                        : "Notification transport did not deliver the warning";
                log.warn("Proactive delay warning {} for {} not delivered: {}",
                        sent.getNotificationId(), shipmentId, reason);
                return ProactiveWarningResult.builder()
                        .success(false)
                        .shipmentId(shipmentId)
                        .warningSent(false)
                        .mlConfidence(confidence)
                        .threshold(threshold)
                        .reason(reason)
                        .notificationId(sent.getNotificationId())
                        .build();
            }

            log.info("Proactive delay warning {} sent for {}: confidence={}",
                    sent.getNotificationId(), shipmentId, confidence);

            return ProactiveWarningResult.builder()
                    .success(true)
                    .shipmentId(shipmentId)
                    .warningSent(true)
                    .mlConfidence(confidence)
                    .threshold(threshold)
                    .riskFactors(riskFactors)
                    .predictedDelayHours(p.getPredictedDelayHours())
                    .notificationId(sent.getNotificationId())
                    .build();
        } catch (RuntimeException e) {
            log.error("Error in proactive delay warning for {}: {}", shipmentId, e.getMessage(), e);
            return ProactiveWarningResult.builder()
                    .success(false)
                    .shipmentId(shipmentId)
                    .warningSent(false)
                    .mlConfidence(confidence)
                    .threshold(threshold)
                    .error(e.getMessage())
                    .build();
        }
    }
}
