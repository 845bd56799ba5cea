package com.cargo.monitor.notification;

public record RenderedMessage(String subject, String body) {}
