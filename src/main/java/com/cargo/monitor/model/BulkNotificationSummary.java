package com.cargo.monitor.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class BulkNotificationSummary {

    int total;

    int successful;

    int failed;

    List<NotificationRecord> results;

    List<String> failedShipmentIds;
}
