package com.cargo.monitor.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Geographic coordinate in decimal degrees")
public record GeoPoint(double latitude, double longitude) {}
