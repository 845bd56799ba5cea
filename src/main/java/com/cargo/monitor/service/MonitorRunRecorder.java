package com.cargo.monitor.service;

import com.cargo.monitor.config.MetricsConfig;
import com.cargo.monitor.model.MonitorRunRecord;
import com.cargo.monitor.repository.MonitorRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Appends one history row per cycle. A failed write is logged and dropped: it never fails
 * the cycle and is never retried.
 */
@Service
public class MonitorRunRecorder {

    private static final Logger log = LoggerFactory.getLogger(MonitorRunRecorder.class);

    private final MonitorRunRepository repository;
    private final MetricsConfig metricsConfig;

    public MonitorRunRecorder(MonitorRunRepository repository, MetricsConfig metricsConfig) {
        this.repository = repository;
        this.metricsConfig = metricsConfig;
    }

    public void record(MonitorRunRecord run) {
        try {
            repository.save(run);
            log.info("Logged monitoring run {}: checked={}, found={}, sent={}, durationMs={}",
                    run.getRunId(), run.getShipmentsChecked(), run.getExceptionsFound(),
                    run.getNotificationsSent(), run.getRunDurationMs());
        } catch (RuntimeException e) {
            metricsConfig.recordHistoryWriteFailure();
            log.error("Failed to persist monitoring run {}: {}", run.getRunId(), e.getMessage(), e);
        }
    }

    public List<MonitorRunRecord> findRecent(int limit) {
        return repository.findRecent(limit);
    }
}
