package com.cargo.monitor.notification;

import com.cargo.monitor.config.MetricsConfig;
import com.cargo.monitor.config.TwilioNotificationConfig;
import com.cargo.monitor.model.Language;
import com.cargo.monitor.model.NotificationChannel;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * SMS through Twilio when enabled. With Twilio disabled (the default) both channels run in
 * mock mode: the rendered message is logged and reported as sent.
 */
@Component
public class TwilioNotificationTransport implements NotificationTransport {

    private static final Logger log = LoggerFactory.getLogger(TwilioNotificationTransport.class);

    private final TwilioNotificationConfig config;
    private final NotificationTemplateService templateService;
    private final MetricsConfig metricsConfig;

    public TwilioNotificationTransport(TwilioNotificationConfig config,
                                       NotificationTemplateService templateService,
                                       MetricsConfig metricsConfig) {
        this.config = config;
        this.templateService = templateService;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio notification transport initialized. Channel: {}", config.getChannel());
        } else {
            log.info("Twilio notification transport is DISABLED, notifications will be logged only.");
        }
    }

    @Override
    public TransportResult send(Set<NotificationChannel> channels,
                                Recipient recipient,
                                Language language,
                                String templateKey,
                                Map<String, String> context) {
        String notificationId = context.get("notification_id");
        RenderedMessage message = templateService.render(templateKey, language, context);
        boolean allSent = !channels.isEmpty();

        if (channels.contains(NotificationChannel.EMAIL)) {
            allSent &= sendEmail(recipient, message, notificationId);
        }
        if (channels.contains(NotificationChannel.SMS)) {
            allSent &= sendSms(recipient, context, notificationId);
        }

        return new TransportResult(allSent, notificationId);
    }

    private boolean sendEmail(Recipient recipient, RenderedMessage message, String notificationId) {
        if (!recipient.hasEmail()) {
            return false;
        }
        // No email provider is wired yet; email always runs in mock mode
        log.info("[MOCK] Email {} to {} subject='{}'", notificationId, recipient.email(), message.subject());
        log.debug("[MOCK] Email body: {}", message.body());
        metricsConfig.recordNotification("email", "mock");
        return true;
    }

    private boolean sendSms(Recipient recipient, Map<String, String> context, String notificationId) {
        if (!recipient.hasPhone()) {
            return false;
        }

        String body = buildSmsBody(context);
        if (!config.isEnabled()) {
            log.info("[MOCK] SMS {} to {}: {}", notificationId, recipient.phone(), body);
            metricsConfig.recordNotification("sms", "mock");
            return true;
        }

        try {
            Message message = Message.creator(
                    new PhoneNumber(resolveNumber(recipient.phone())),
                    new PhoneNumber(resolveNumber(config.getFromNumber())),
                    body
            ).create();

            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("Twilio notification {} sent, sid={}", notificationId, message.getSid());
            return true;
        } catch (Exception e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Failed to send Twilio notification {}: {}", notificationId, e.getMessage(), e);
            return false;
        }
    }

    // SMS carries a one-line summary rather than the full email body
    private String buildSmsBody(Map<String, String> context) {
        return String.format("CW Logistics: Shipment %s - %s. Track: %s",
                context.getOrDefault("shipment_id", "?"),
                context.getOrDefault("notification_title", "Update"),
                context.getOrDefault("tracking_url", ""));
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
