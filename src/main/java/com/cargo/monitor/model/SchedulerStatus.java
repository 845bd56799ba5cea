package com.cargo.monitor.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@Schema(description = "Live state of the monitoring scheduler")
public class SchedulerStatus {

    SchedulerState state;

    boolean started;

    long intervalSeconds;

    long totalRuns;

    long skippedTicks;

    Instant lastRunAt;
}
