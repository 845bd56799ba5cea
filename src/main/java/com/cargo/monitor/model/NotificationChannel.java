package com.cargo.monitor.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationChannel {
    EMAIL,
    SMS;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase();
    }
}
