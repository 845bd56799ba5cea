package com.cargo.monitor.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

@Value
@Builder
@Schema(description = "Notification handed to a transport or to the exception handler")
public class NotificationRecord {

    @Schema(example = "NOTIF-20241012-3f2a9c1b")
    String notificationId;

    @Schema(example = "SHP-2024-001")
    String shipmentId;

    @Schema(description = "Exception type or customer notification kind", example = "delayed")
    String type;

    Instant sentAt;

    @Schema(description = "Channels the transport confirmed; empty when nothing went out")
    Set<NotificationChannel> channels;

    @Schema(description = "True only if at least one channel accepted the message", example = "true")
    boolean delivered;

    Language language;

    @Schema(description = "Rendered subject line")
    String messagePreview;

    String trackingUrl;
}
