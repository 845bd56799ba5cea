package com.cargo.monitor.repository;

import com.cargo.monitor.model.ShipmentSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Source of active shipment state. Implementations must be safe to call repeatedly and
 * must return every shipment that is active when called. {@code asOf} is the cycle's
 * {@code now}; a shipment whose data changed after it is still returned.
 */
public interface ShipmentSnapshotProvider {

    /**
     * @throws com.cargo.monitor.exception.SnapshotUnavailableException if the active set cannot be read
     */
    List<ShipmentSnapshot> listActiveShipments(Instant asOf);

    /**
     * Single-shipment lookup. The default scans the active set; stores with keyed access
     * should override it.
     */
    default Optional<ShipmentSnapshot> findActiveShipment(String shipmentId, Instant asOf) {
        return listActiveShipments(asOf).stream()
                .filter(s -> s.getShipmentId().equals(shipmentId))
                .findFirst();
    }
}
