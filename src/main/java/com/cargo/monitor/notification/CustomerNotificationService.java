package com.cargo.monitor.notification;

import com.cargo.monitor.model.BulkNotificationSummary;
import com.cargo.monitor.model.Language;
import com.cargo.monitor.model.NotificationChannel;
import com.cargo.monitor.model.NotificationKind;
import com.cargo.monitor.model.NotificationRecord;
import com.cargo.monitor.model.StatusUpdateRequest;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Customer-facing status notifications (departed, arrived, delayed, ...).
 * The notification id is generated before the transport is called so a failed send can
 * still be traced in the logs.
 */
@Service
public class CustomerNotificationService {

    private static final Logger log = LoggerFactory.getLogger(CustomerNotificationService.class);

    static final String TRACKING_URL_BASE = "https://track.cwlogistics.com/";

    private final NotificationTransport transport;
    private final NotificationTemplateService templateService;
    private final NotificationIdGenerator idGenerator;
    private final Clock clock;

    public CustomerNotificationService(NotificationTransport transport,
                                       NotificationTemplateService templateService,
                                       NotificationIdGenerator idGenerator,
                                       Clock clock) {
        this.transport = transport;
        this.templateService = templateService;
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException if the shipment id is blank or the notification type is unknown
     */
    @Observed(name = "notification.status_update", contextualName = "send-status-update")
    public NotificationRecord sendStatusUpdate(StatusUpdateRequest request) {
        if (request.getShipmentId() == null || request.getShipmentId().isBlank()) {
            throw new IllegalArgumentException("shipmentId is required");
        }
        NotificationKind kind = NotificationKind.fromCode(request.getNotificationType());

        if (request.getLanguage() != null && !Language.isSupported(request.getLanguage())) {
            log.warn("Unsupported language: {}, falling back to 'en'", request.getLanguage());
        }
        Language language = Language.fromCode(request.getLanguage());

        String shipmentId = request.getShipmentId();
        String trackingUrl = request.getTrackingUrl() != null
                ? request.getTrackingUrl() : TRACKING_URL_BASE + shipmentId;
        String notificationId = idGenerator.next();

        Map<String, String> context = new HashMap<>();
        context.put("origin", "Origin Port");
        context.put("destination", "Destination Port");
        context.put("container", "N/A");
        if (request.getAdditionalData() != null) {
            context.putAll(request.getAdditionalData());
        }
        context.put("shipment_id", shipmentId);
        context.put("tracking_url", trackingUrl);
        context.put("notification_id", notificationId);
        context.put("notification_title", kind.displayName());

        NotificationTransport.Recipient recipient =
                new NotificationTransport.Recipient(request.getRecipientEmail(), request.getRecipientPhone());
        Set<NotificationChannel> channels = EnumSet.noneOf(NotificationChannel.class);
        if (recipient.hasEmail()) channels.add(NotificationChannel.EMAIL);
        if (recipient.hasPhone()) channels.add(NotificationChannel.SMS);

        String templateKey = NotificationTemplateService.keyFor(kind);
        RenderedMessage preview = templateService.render(templateKey, language, context);

        log.info("Sending notification {}: {} for shipment {} via {}", notificationId, kind.getCode(), shipmentId, channels);
        Set<NotificationChannel> delivered = channels;
        if (!channels.isEmpty()) {
            TransportResult result = transport.send(channels, recipient, language, templateKey, context);
            if (!result.sent()) {
                log.warn("Notification {} was not fully delivered", notificationId);
                delivered = EnumSet.noneOf(NotificationChannel.class);
            }
        }

        return NotificationRecord.builder()
                .notificationId(notificationId)
                .shipmentId(shipmentId)
                .type(kind.getCode())
                .sentAt(clock.instant())
                .channels(Collections.unmodifiableSet(delivered))
                .delivered(!delivered.isEmpty())
                .language(language)
                .messagePreview(preview.subject())
                .trackingUrl(trackingUrl)
                .build();
    }

    /**
     * Send the same notification type to several shipments. One failure does not stop the rest.
     */
    public BulkNotificationSummary sendBulk(List<String> shipmentIds, String notificationType, String language) {
        List<NotificationRecord> results = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        for (String shipmentId : shipmentIds) {
            try {
                results.add(sendStatusUpdate(StatusUpdateRequest.builder()
                        .shipmentId(shipmentId)
                        .notificationType(notificationType)
                        .language(language)
                        .build()));
            } catch (RuntimeException e) {
                log.error("Error sending notification for {}: {}", shipmentId, e.getMessage());
                failed.add(shipmentId);
            }
        }

        return BulkNotificationSummary.builder()
                .total(shipmentIds.size())
                .successful(results.size())
                .failed(failed.size())
                .results(results)
                .failedShipmentIds(failed)
                .build();
    }
}
