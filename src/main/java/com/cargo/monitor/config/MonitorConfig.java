package com.cargo.monitor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "monitor")
public class MonitorConfig {

    // Shared by the periodic ML rule and the on-demand proactive warning gate.
    public static final double DEFAULT_ML_CONFIDENCE_THRESHOLD = 0.70;

    // Soft deadline for one cycle. Keep it below the scheduling interval.
    private Duration cycleDeadline = Duration.ofMinutes(4);

    private Scheduler scheduler = new Scheduler();

    private Thresholds thresholds = new Thresholds();

    private Evaluation evaluation = new Evaluation();

    private Dispatch dispatch = new Dispatch();

    @Data
    public static class Scheduler {
        // Auto-start the repeating cycle when the application context starts
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(5);
        private Duration initialDelay = Duration.ofMinutes(1);
        // Upper bound on how long stop() waits for an in-flight cycle to drain
        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Thresholds {
        private double delayHours = 24.0;
        private double delayHighHours = 48.0;
        private double mlConfidence = DEFAULT_ML_CONFIDENCE_THRESHOLD;
        private double mlConfidenceHigh = 0.85;
        private double temperatureDeviationCelsius = 5.0;
        private double temperatureDeviationHighCelsius = 10.0;
        private double missingMilestoneHours = 72.0;
    }

    @Data
    public static class Evaluation {
        // Worker threads for the per-shipment rule fan-out
        private int parallelism = 4;
    }

    @Data
    public static class Dispatch {
        private String baseUrl = "http://localhost:9000";
        private String skill = "handle-exception";
        private String crew = "exception";
        private String language = "en";
        // One attempt plus one retry on transient failure
        private int maxAttempts = 2;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);
    }
}
