package com.cargo.monitor.service;

import com.cargo.monitor.config.MetricsConfig;
import com.cargo.monitor.config.MonitorConfig;
import com.cargo.monitor.engine.EvaluationContext;
import com.cargo.monitor.engine.ExceptionAggregator;
import com.cargo.monitor.exception.SnapshotUnavailableException;
import com.cargo.monitor.model.DispatchOutcome;
import com.cargo.monitor.model.DispatchStatus;
import com.cargo.monitor.model.ExceptionFinding;
import com.cargo.monitor.model.MonitorRunRecord;
import com.cargo.monitor.model.MonitorRunResult;
import com.cargo.monitor.model.RunStatus;
import com.cargo.monitor.model.ShipmentSnapshot;
import com.cargo.monitor.repository.ShipmentSnapshotProvider;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * One monitoring cycle.
 *
 * Flow:
 * 1. Capture {@code now} once and snapshot every active shipment as of that instant
 * 2. Evaluate all rules over all shipments (parallel per shipment, joined)
 * 3. Deduplicate and order findings by severity
 * 4. Dispatch each finding to the exception handler
 * 5. Append one run record to the history
 *
 * Single-flight is not enforced here; {@link MonitorScheduler} owns that guard.
 */
@Service
public class ExceptionMonitorService {

    private static final Logger log = LoggerFactory.getLogger(ExceptionMonitorService.class);

    private static final DateTimeFormatter RUN_ID_TIME =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    private final ShipmentSnapshotProvider snapshotProvider;
    private final ExceptionAggregator aggregator;
    private final NotificationDispatcher dispatcher;
    private final MonitorRunRecorder recorder;
    private final MonitorConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public ExceptionMonitorService(ShipmentSnapshotProvider snapshotProvider,
                                   ExceptionAggregator aggregator,
                                   NotificationDispatcher dispatcher,
                                   MonitorRunRecorder recorder,
                                   MonitorConfig config,
                                   MetricsConfig metricsConfig,
                                   Clock clock) {
        this.snapshotProvider = snapshotProvider;
        this.aggregator = aggregator;
        this.dispatcher = dispatcher;
        this.recorder = recorder;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @Observed(name = "monitor.run", contextualName = "exception-monitor-run")
    public MonitorRunResult runOnce(CancellationToken token) {
        Instant now = clock.instant();
        long startNanos = System.nanoTime();
        String runId = newRunId(now);
        Instant deadline = now.plus(config.getCycleDeadline());

        log.info("Starting exception monitoring cycle {}", runId);

        List<ShipmentSnapshot> snapshots;
        try {
            snapshots = snapshotProvider.listActiveShipments(now);
        } catch (RuntimeException e) {
            SnapshotUnavailableException failure = e instanceof SnapshotUnavailableException s
                    ? s : new SnapshotUnavailableException("Snapshot provider failed: " + e.getMessage(), e);
            log.error("Aborting cycle {}: {}", runId, failure.getMessage(), failure);
            return finish(runId, now, startNanos, 0, List.of(), List.of(), RunStatus.SNAPSHOT_UNAVAILABLE);
        }

        EvaluationContext context = EvaluationContext.builder().runId(runId).now(now).build();
        List<ExceptionFinding> findings = aggregator.aggregate(snapshots, context);
        log.info("Detected {} exceptions across {} shipments", findings.size(), snapshots.size());

        List<DispatchOutcome> outcomes = findings.isEmpty()
                ? List.of()
                : dispatcher.dispatchAll(findings, deadline, token);

        return finish(runId, now, startNanos, snapshots.size(), findings, outcomes, statusOf(outcomes, token));
    }

    private MonitorRunResult finish(String runId, Instant startedAt, long startNanos, int shipmentsChecked,
                                    List<ExceptionFinding> findings, List<DispatchOutcome> outcomes,
                                    RunStatus status) {
        int sent = (int) outcomes.stream().filter(o -> o.getStatus().isSuccess()).count();
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

        MonitorRunRecord record = MonitorRunRecord.builder()
                .runId(runId)
                .runTimestamp(startedAt)
                .shipmentsChecked(shipmentsChecked)
                .exceptionsFound(findings.size())
                .notificationsSent(sent)
                .dispatchFailures(findings.size() - sent)
                .runDurationMs(Math.max(0, durationMs))
                .status(status)
                .build();

        recorder.record(record);
        metricsConfig.recordRun(status, record.getRunDurationMs(), record.getExceptionsFound());

        log.info("Monitoring cycle {} complete: status={}, checked={}, found={}, sent={}, durationMs={}",
                runId, status, shipmentsChecked, findings.size(), sent, record.getRunDurationMs());

        return MonitorRunResult.builder()
                .record(record)
                .findings(findings)
                .outcomes(outcomes)
                .build();
    }

    private RunStatus statusOf(List<DispatchOutcome> outcomes, CancellationToken token) {
        if (token.isCancelled() && outcomes.stream().anyMatch(o -> o.getStatus() == DispatchStatus.SKIPPED)) {
            return RunStatus.CANCELLED;
        }
        if (outcomes.stream().anyMatch(o -> o.getStatus() == DispatchStatus.ABANDONED)) {
            return RunStatus.DEADLINE_EXCEEDED;
        }
        return RunStatus.COMPLETED;
    }

    private String newRunId(Instant now) {
        return "RUN-" + RUN_ID_TIME.format(now) + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
