package com.cargo.monitor.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.cargo.monitor.config.AerospikeConfig;
import com.cargo.monitor.exception.PersistenceException;
import com.cargo.monitor.model.MonitorRunRecord;
import com.cargo.monitor.model.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Append-only store of monitoring cycles. Records are created once and never updated.
 */
@Repository
public class MonitorRunRepository {

    private static final Logger log = LoggerFactory.getLogger(MonitorRunRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;

    public MonitorRunRepository(AerospikeClient client,
                                @Qualifier("aerospikeNamespace") String namespace,
                                @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
    }

    public void save(MonitorRunRecord run) {
        Key key = new Key(namespace, AerospikeConfig.SET_MONITOR_RUNS, run.getRunId());

        Bin runIdBin = new Bin("runId", run.getRunId());
        Bin timestampBin = new Bin("runTimestamp", run.getRunTimestamp().toEpochMilli());
        Bin checkedBin = new Bin("shipChecked", run.getShipmentsChecked());
        Bin foundBin = new Bin("exceptionsFound", run.getExceptionsFound());
        Bin sentBin = new Bin("notifSent", run.getNotificationsSent());
        Bin failuresBin = new Bin("dispatchFails", run.getDispatchFailures());
        Bin durationBin = new Bin("runDurationMs", run.getRunDurationMs());
        Bin statusBin = new Bin("status", run.getStatus().name());

        try {
            client.put(writePolicy, key,
                    runIdBin, timestampBin, checkedBin, foundBin,
                    sentBin, failuresBin, durationBin, statusBin);
        } catch (AerospikeException e) {
            throw new PersistenceException("Failed to append run " + run.getRunId() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Most recent runs first.
     */
    public List<MonitorRunRecord> findRecent(int limit) {
        List<MonitorRunRecord> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_MONITOR_RUNS,
                (key, record) -> {
                    try {
                        MonitorRunRecord run = mapRecord(record);
                        synchronized (results) {
                            results.add(run);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read monitor run record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparing(MonitorRunRecord::getRunTimestamp).reversed());
        if (results.size() > limit) {
            return new ArrayList<>(results.subList(0, limit));
        }
        return results;
    }

    private MonitorRunRecord mapRecord(Record record) {
        return MonitorRunRecord.builder()
                .runId(record.getString("runId"))
                .runTimestamp(Instant.ofEpochMilli(record.getLong("runTimestamp")))
                .shipmentsChecked(record.getInt("shipChecked"))
                .exceptionsFound(record.getInt("exceptionsFound"))
                .notificationsSent(record.getInt("notifSent"))
                .dispatchFailures(record.getInt("dispatchFails"))
                .runDurationMs(record.getLong("runDurationMs"))
                .status(RunStatus.valueOf(record.getString("status")))
                .build();
    }
}
