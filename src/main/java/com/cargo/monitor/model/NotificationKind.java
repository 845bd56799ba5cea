package com.cargo.monitor.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Customer-facing notification kinds.
 */
public enum NotificationKind {
    DEPARTED,
    IN_TRANSIT,
    ARRIVED,
    CUSTOMS_CLEARED,
    DELIVERED,
    DELAYED,
    EXCEPTION;

    public static NotificationKind fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Notification type is required");
        }
        for (NotificationKind kind : values()) {
            if (kind.getCode().equalsIgnoreCase(code.trim())) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Invalid notification type: " + code
                + ". Must be one of departed, in_transit, arrived, customs_cleared, delivered, delayed, exception");
    }

    @JsonValue
    public String getCode() {
        return name().toLowerCase();
    }

    public String displayName() {
        String[] words = getCode().split("_");
        StringBuilder sb = new StringBuilder();
        for (String word : words) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return sb.toString();
    }
}
