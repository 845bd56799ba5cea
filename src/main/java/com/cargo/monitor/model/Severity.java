package com.cargo.monitor.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Ordinal exception priority. Higher rank dispatches first.
 */
public enum Severity {
    LOW(1),
    MEDIUM(2),
    HIGH(3);

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    public boolean isHigherThan(Severity other) {
        return rank > other.rank;
    }

    @JsonValue
    public String getWireName() {
        return name().toLowerCase();
    }
}
