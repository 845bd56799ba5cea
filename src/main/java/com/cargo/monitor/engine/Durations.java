package com.cargo.monitor.engine;

import java.time.Duration;
import java.time.Instant;

public final class Durations {

    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    private Durations() {}

    public static double hours(Duration duration) {
        return duration.toMillis() / MILLIS_PER_HOUR;
    }

    public static double hoursBetween(Instant from, Instant to) {
        return hours(Duration.between(from, to));
    }
}
