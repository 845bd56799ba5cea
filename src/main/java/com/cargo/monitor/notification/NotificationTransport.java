package com.cargo.monitor.notification;

import com.cargo.monitor.model.Language;
import com.cargo.monitor.model.NotificationChannel;

import java.util.Map;
import java.util.Set;

/**
 * Delivery capability for customer notifications. Implementations own the actual email and
 * SMS plumbing; callers only pick channels, language and template.
 */
public interface NotificationTransport {

    TransportResult send(Set<NotificationChannel> channels,
                         Recipient recipient,
                         Language language,
                         String templateKey,
                         Map<String, String> context);

    record Recipient(String email, String phone) {

        public boolean hasEmail() {
            return email != null && !email.isBlank();
        }

        public boolean hasPhone() {
            return phone != null && !phone.isBlank();
        }
    }
}
