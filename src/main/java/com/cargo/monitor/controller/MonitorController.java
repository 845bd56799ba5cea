package com.cargo.monitor.controller;

import com.cargo.monitor.model.MonitorRunRecord;
import com.cargo.monitor.model.MonitorRunResult;
import com.cargo.monitor.model.SchedulerStatus;
import com.cargo.monitor.service.MonitorRunRecorder;
import com.cargo.monitor.service.MonitorScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/monitor")
@Tag(name = "Exception Monitor", description = "Periodic shipment exception detection and run history")
public class MonitorController {

    private final MonitorScheduler scheduler;
    private final MonitorRunRecorder recorder;

    public MonitorController(MonitorScheduler scheduler, MonitorRunRecorder recorder) {
        this.scheduler = scheduler;
        this.recorder = recorder;
    }

    @GetMapping("/status")
    @Operation(summary = "Get scheduler status",
               description = "Lifecycle state, interval, completed runs and skipped ticks")
    public ResponseEntity<SchedulerStatus> getStatus() {
        return ResponseEntity.ok(scheduler.getStatus());
    }

    @PostMapping("/run")
    @Operation(summary = "Run a monitoring cycle now",
               description = "Runs one cycle synchronously. Returns 409 if a cycle is already in flight.")
    public ResponseEntity<?> triggerRun() {
        Optional<MonitorRunResult> result = scheduler.triggerNow();
        if (result.isEmpty()) {
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("error", "A monitoring cycle is already running or the monitor is stopping");
            response.put("state", scheduler.getState());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
        }
        return ResponseEntity.ok(result.get());
    }

    @GetMapping("/runs")
    @Operation(summary = "List recent monitoring runs",
               description = "Run history, newest first")
    public ResponseEntity<List<MonitorRunRecord>> getRecentRuns(
            @RequestParam(defaultValue = "20") int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return ResponseEntity.ok(recorder.findRecent(limit));
    }
}
