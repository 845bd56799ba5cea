package com.cargo.monitor.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.cargo.monitor.config.AerospikeConfig;
import com.cargo.monitor.exception.SnapshotUnavailableException;
import com.cargo.monitor.model.GeoPoint;
import com.cargo.monitor.model.ReeferTelemetry;
import com.cargo.monitor.model.RouteCorridor;
import com.cargo.monitor.model.ShipmentSnapshot;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Reads the active shipment set maintained by the tracking ingestion pipeline.
 *
 * Every non-delivered record is returned as read, including ones the feeds updated after
 * {@code asOf}; rules judge them against the cycle's {@code now}. A record that cannot be
 * mapped is logged and skipped without affecting the rest of the scan.
 */
@Repository
public class ShipmentSnapshotRepository implements ShipmentSnapshotProvider {

    private static final Logger log = LoggerFactory.getLogger(ShipmentSnapshotRepository.class);

    private static final String STATUS_DELIVERED = "delivered";

    private final AerospikeClient client;
    private final String namespace;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public ShipmentSnapshotRepository(AerospikeClient client,
                                      @Qualifier("aerospikeNamespace") String namespace,
                                      @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public List<ShipmentSnapshot> listActiveShipments(Instant asOf) {
        List<ShipmentSnapshot> snapshots = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ACTIVE_SHIPMENTS,
                    (key, record) -> {
                        // A bin of the wrong type throws from the typed getters; skip just that record
                        try {
                            if (STATUS_DELIVERED.equalsIgnoreCase(record.getString("status"))) return;
                            ShipmentSnapshot snapshot = mapRecord(record);
                            synchronized (snapshots) {
                                snapshots.add(snapshot);
                            }
                        } catch (RuntimeException e) {
                            log.warn("Skipping malformed shipment record {}: {}",
                                    record.getValue("shipmentId"), e.getMessage());
                        }
                    });
        } catch (AerospikeException e) {
            throw new SnapshotUnavailableException("Active shipment scan failed: " + e.getMessage(), e);
        }

        snapshots.sort(Comparator.comparing(ShipmentSnapshot::getShipmentId));
        log.info("Found {} active shipments to monitor as of {}", snapshots.size(), asOf);
        return snapshots;
    }

    @Override
    public Optional<ShipmentSnapshot> findActiveShipment(String shipmentId, Instant asOf) {
        Key key = new Key(namespace, AerospikeConfig.SET_ACTIVE_SHIPMENTS, shipmentId);
        Record record;
        try {
            record = client.get(readPolicy, key);
        } catch (AerospikeException e) {
            throw new SnapshotUnavailableException("Shipment lookup failed for " + shipmentId + ": " + e.getMessage(), e);
        }
        if (record == null || STATUS_DELIVERED.equalsIgnoreCase(record.getString("status"))) {
            return Optional.empty();
        }
        return Optional.of(mapRecord(record));
    }

    ShipmentSnapshot mapRecord(Record record) {
        String shipmentId = record.getString("shipmentId");
        if (shipmentId == null || shipmentId.isBlank()) {
            throw new IllegalArgumentException("shipmentId is missing");
        }

        ShipmentSnapshot.ShipmentSnapshotBuilder builder = ShipmentSnapshot.builder()
                .shipmentId(shipmentId)
                .scheduledEta(instantOrNull(record, "scheduledEta"))
                .currentEtaEstimate(instantOrNull(record, "currentEta"))
                .mlDelayConfidence(record.getDouble("mlConfidence"))
                .mlRiskFactors(deserializeStrings(record.getString("riskFactors")))
                .lastMilestoneAt(instantOrNull(record, "lastMilestoneAt"))
                .lastMilestoneName(record.getString("lastMilestone"));

        if (record.getValue("predDelayHrs") != null) {
            builder.predictedDelayHours(record.getDouble("predDelayHrs"));
        }
        if (record.getValue("milestoneIntHrs") != null) {
            builder.expectedMilestoneInterval(Duration.ofHours(record.getLong("milestoneIntHrs")));
        }
        if (record.getValue("reeferTemp") != null && record.getValue("reeferSetpoint") != null) {
            builder.reeferTelemetry(ReeferTelemetry.builder()
                    .containerId(record.getString("reeferId"))
                    .temperatureCelsius(record.getDouble("reeferTemp"))
                    .setpointCelsius(record.getDouble("reeferSetpoint"))
                    .build());
        }
        if (record.getValue("lat") != null && record.getValue("lon") != null) {
            builder.currentPosition(new GeoPoint(record.getDouble("lat"), record.getDouble("lon")));
        }
        String corridorJson = record.getString("corridor");
        if (corridorJson != null && !corridorJson.isEmpty()) {
            builder.expectedRouteCorridor(deserializeCorridor(corridorJson));
        }

        return builder.build();
    }

    private Instant instantOrNull(Record record, String bin) {
        return record.getValue(bin) != null ? Instant.ofEpochMilli(record.getLong(bin)) : null;
    }

    private List<String> deserializeStrings(String json) {
        if (json == null || json.isEmpty()) return Collections.emptyList();
        try {
            return objectMapper.readValue(json, new TypeReference<List<String>>() {});
        } catch (Exception e) {
            log.error("Failed to deserialize risk factors", e);
            return Collections.emptyList();
        }
    }

    private RouteCorridor deserializeCorridor(String json) {
        try {
            List<double[]> points = objectMapper.readValue(json, new TypeReference<List<double[]>>() {});
            List<GeoPoint> vertices = new ArrayList<>(points.size());
            for (double[] point : points) {
                vertices.add(new GeoPoint(point[0], point[1]));
            }
            return new RouteCorridor(vertices);
        } catch (Exception e) {
            throw new IllegalArgumentException("Invalid corridor: " + e.getMessage(), e);
        }
    }
}
