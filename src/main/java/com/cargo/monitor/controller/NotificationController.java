package com.cargo.monitor.controller;

import com.cargo.monitor.model.BulkNotificationRequest;
import com.cargo.monitor.model.BulkNotificationSummary;
import com.cargo.monitor.model.NotificationRecord;
import com.cargo.monitor.model.ProactiveWarningRequest;
import com.cargo.monitor.model.ProactiveWarningResult;
import com.cargo.monitor.model.StatusUpdateRequest;
import com.cargo.monitor.notification.CustomerNotificationService;
import com.cargo.monitor.service.ProactiveDelayWarningService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/notifications")
@Tag(name = "Customer Notifications", description = "Shipment status updates and proactive delay warnings")
public class NotificationController {

    private final CustomerNotificationService notificationService;
    private final ProactiveDelayWarningService warningService;

    public NotificationController(CustomerNotificationService notificationService,
                                  ProactiveDelayWarningService warningService) {
        this.notificationService = notificationService;
        this.warningService = warningService;
    }

    @PostMapping("/proactive-warning")
    @Operation(summary = "Send a proactive delay warning",
               description = "Warns the customer only if the delay classifier's confidence is above the ML threshold")
    public ResponseEntity<ProactiveWarningResult> proactiveWarning(@RequestBody ProactiveWarningRequest request) {
        return ResponseEntity.ok(warningService.warn(request));
    }

    @PostMapping("/status-update")
    @Operation(summary = "Send a shipment status update",
               description = "Renders the localized template and delivers it by email and/or SMS")
    public ResponseEntity<NotificationRecord> statusUpdate(@RequestBody StatusUpdateRequest request) {
        return ResponseEntity.ok(notificationService.sendStatusUpdate(request));
    }

    @PostMapping("/bulk")
    @Operation(summary = "Send bulk status updates",
               description = "Same notification type for several shipments; failures are reported, not fatal")
    public ResponseEntity<BulkNotificationSummary> bulk(@RequestBody BulkNotificationRequest request) {
        if (request.getShipmentIds() == null || request.getShipmentIds().isEmpty()) {
            throw new IllegalArgumentException("shipmentIds must not be empty");
        }
        return ResponseEntity.ok(notificationService.sendBulk(
                request.getShipmentIds(), request.getNotificationType(), request.getLanguage()));
    }
}
