package com.cargo.monitor.notification;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Produces {@code NOTIF-<yyyyMMdd UTC>-<8 hex>} identifiers. The date prefix keeps them
 * sortable by day; the random suffix keeps them unique.
 */
@Component
public class NotificationIdGenerator {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

    private final Clock clock;

    public NotificationIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String next() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        return "NOTIF-" + DAY.format(clock.instant()) + "-" + suffix;
    }
}
