package com.cargo.monitor.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Audit row persisted once per completed monitoring cycle")
public class MonitorRunRecord {

    @Schema(description = "Generated run identifier", example = "RUN-20241012T101500Z-3f2a9c1b")
    private String runId;

    @Schema(description = "Run start time")
    private Instant runTimestamp;

    @Schema(description = "Active shipments evaluated", example = "120")
    private int shipmentsChecked;

    @Schema(description = "Deduplicated findings produced", example = "7")
    private int exceptionsFound;

    @Schema(description = "Findings successfully delivered to the exception handler", example = "6")
    private int notificationsSent;

    @Schema(description = "Findings whose dispatch failed, was rejected or abandoned", example = "1")
    private int dispatchFailures;

    @Schema(description = "Wall-clock duration of the cycle", example = "842")
    private long runDurationMs;

    @Schema(description = "How the cycle ended", example = "COMPLETED")
    private RunStatus status;
}
