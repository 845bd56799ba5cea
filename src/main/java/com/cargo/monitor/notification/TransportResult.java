package com.cargo.monitor.notification;

public record TransportResult(boolean sent, String notificationId) {}
