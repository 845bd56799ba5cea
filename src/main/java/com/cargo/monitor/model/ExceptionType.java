package com.cargo.monitor.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ExceptionType {
    DELAY("delay"),
    ML_PREDICTION("ml_prediction"),
    TEMPERATURE_DEVIATION("temperature_deviation"),
    GEOFENCE_VIOLATION("geofence_violation"),
    MISSING_MILESTONE("missing_milestone");

    private final String wireName;

    ExceptionType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
