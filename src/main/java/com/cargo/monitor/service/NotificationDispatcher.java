package com.cargo.monitor.service;

import com.cargo.monitor.client.ExceptionHandlerClient;
import com.cargo.monitor.client.HandleExceptionMessage;
import com.cargo.monitor.config.MetricsConfig;
import com.cargo.monitor.config.MonitorConfig;
import com.cargo.monitor.exception.DispatchTransportException;
import com.cargo.monitor.model.DispatchOutcome;
import com.cargo.monitor.model.DispatchStatus;
import com.cargo.monitor.model.ExceptionFinding;
import com.cargo.monitor.model.Language;
import com.cargo.monitor.notification.NotificationIdGenerator;
import com.cargo.monitor.notification.NotificationTemplateService;
import com.cargo.monitor.notification.RenderedMessage;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Sends each finding to the exception-handling agent, in the order given.
 *
 * Retry policy: one retry on a transient failure (I/O, timeout, 5xx), none on a rejection
 * (4xx). A failed finding never stops the remaining ones. No attempt starts once the
 * cycle deadline has passed or cancellation has been requested.
 */
@Service
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final ExceptionHandlerClient client;
    private final NotificationTemplateService templateService;
    private final NotificationIdGenerator idGenerator;
    private final MonitorConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public NotificationDispatcher(ExceptionHandlerClient client,
                                  NotificationTemplateService templateService,
                                  NotificationIdGenerator idGenerator,
                                  MonitorConfig config,
                                  MetricsConfig metricsConfig,
                                  Clock clock) {
        this.client = client;
        this.templateService = templateService;
        this.idGenerator = idGenerator;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @Observed(name = "monitor.dispatch_all", contextualName = "dispatch-findings")
    public List<DispatchOutcome> dispatchAll(List<ExceptionFinding> findings, Instant deadline, CancellationToken token) {
        List<DispatchOutcome> outcomes = new ArrayList<>(findings.size());
        for (ExceptionFinding finding : findings) {
            DispatchOutcome outcome = dispatch(finding, deadline, token);
            metricsConfig.recordDispatch(outcome.getStatus());
            outcomes.add(outcome);
        }
        return outcomes;
    }

    DispatchOutcome dispatch(ExceptionFinding finding, Instant deadline, CancellationToken token) {
        // Generated before any attempt so a failure can be correlated in the logs
        String notificationId = idGenerator.next();

        if (token.isCancelled()) {
            log.info("Cancellation requested, skipping {} ({} for {})",
                    notificationId, finding.getType().getWireName(), finding.getShipmentId());
            return outcome(finding, notificationId, DispatchStatus.SKIPPED, 0, null, "cancelled");
        }

        HandleExceptionMessage message;
        try {
            message = buildMessage(finding, notificationId);
        } catch (RuntimeException e) {
            log.error("Could not build message {} for shipment {}: {}",
                    notificationId, finding.getShipmentId(), e.getMessage(), e);
            return outcome(finding, notificationId, DispatchStatus.FAILED, 0, null, e.getMessage());
        }

        int maxAttempts = Math.max(1, config.getDispatch().getMaxAttempts());
        DispatchTransportException lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (!clock.instant().isBefore(deadline)) {
                log.warn("Cycle deadline passed, abandoning {} ({} for {}) after {} attempt(s)",
                        notificationId, finding.getType().getWireName(), finding.getShipmentId(), attempt - 1);
                return outcome(finding, notificationId, DispatchStatus.ABANDONED, attempt - 1,
                        lastFailure != null ? lastFailure.getHttpStatus() : null, "cycle deadline exceeded");
            }

            try {
                log.info("Sending exception {} to handler: {} for {} (attempt {})",
                        notificationId, finding.getType().getWireName(), finding.getShipmentId(), attempt);
                int status = client.send(message);
                return outcome(finding, notificationId, DispatchStatus.SENT, attempt, status, null);
            } catch (DispatchTransportException e) {
                lastFailure = e;
                if (!e.isTransient()) {
                    log.warn("Exception handler rejected {} for {}: {}",
                            notificationId, finding.getShipmentId(), e.getMessage());
                    return outcome(finding, notificationId, DispatchStatus.REJECTED, attempt,
                            e.getHttpStatus(), e.getMessage());
                }
                log.warn("Transient failure sending {} (attempt {}/{}): {}",
                        notificationId, attempt, maxAttempts, e.getMessage());
            }
        }

        log.error("Giving up on {} for shipment {} after {} attempts",
                notificationId, finding.getShipmentId(), maxAttempts);
        return outcome(finding, notificationId, DispatchStatus.FAILED, maxAttempts,
                lastFailure != null ? lastFailure.getHttpStatus() : null,
                lastFailure != null ? lastFailure.getMessage() : null);
    }

    HandleExceptionMessage buildMessage(ExceptionFinding finding, String notificationId) {
        MonitorConfig.Dispatch dispatch = config.getDispatch();
        Language language = Language.fromCode(dispatch.getLanguage());

        Map<String, String> context = new HashMap<>();
        context.put("shipment_id", finding.getShipmentId());
        context.put("severity", finding.getSeverity().getWireName().toUpperCase());
        context.put("notification_id", notificationId);
        context.put("message", finding.getDetails() != null ? finding.getDetails().getMessage() : "");

        RenderedMessage rendered = templateService.render(
                NotificationTemplateService.keyFor(finding.getType()), language, context);

        return new HandleExceptionMessage(
                dispatch.getSkill(),
                dispatch.getCrew(),
                finding.getType(),
                finding.getSeverity(),
                finding.getShipmentId(),
                notificationId,
                rendered.subject(),
                rendered.body(),
                finding.getDetails());
    }

    private DispatchOutcome outcome(ExceptionFinding finding, String notificationId, DispatchStatus status,
                                    int attempts, Integer httpStatus, String error) {
        return DispatchOutcome.builder()
                .notificationId(notificationId)
                .shipmentId(finding.getShipmentId())
                .type(finding.getType())
                .severity(finding.getSeverity())
                .status(status)
                .attempts(attempts)
                .httpStatus(httpStatus)
                .error(error)
                .build();
    }
}
