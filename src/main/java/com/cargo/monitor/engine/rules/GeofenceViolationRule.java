package com.cargo.monitor.engine.rules;

import com.cargo.monitor.engine.EvaluationContext;
import com.cargo.monitor.engine.ExceptionRule;
import com.cargo.monitor.model.ExceptionFinding;
import com.cargo.monitor.model.ExceptionType;
import com.cargo.monitor.model.FindingDetails;
import com.cargo.monitor.model.GeoPoint;
import com.cargo.monitor.model.RouteCorridor;
import com.cargo.monitor.model.Severity;
import com.cargo.monitor.model.ShipmentSnapshot;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Detects shipments that have left their expected route corridor.
 * Always HIGH. Without both a position and a corridor there is nothing to check.
 */
@Component
@Order(4)
public class GeofenceViolationRule implements ExceptionRule {

    @Override
    public ExceptionType getSupportedType() {
        return ExceptionType.GEOFENCE_VIOLATION;
    }

    @Override
    public Optional<ExceptionFinding> evaluate(ShipmentSnapshot snapshot, EvaluationContext context) {
        Optional<GeoPoint> position = snapshot.getCurrentPosition();
        Optional<RouteCorridor> corridor = snapshot.getExpectedRouteCorridor();
        if (position.isEmpty() || corridor.isEmpty()) {
            return Optional.empty();
        }

        GeoPoint point = position.get();
        if (corridor.get().contains(point)) {
            return Optional.empty();
        }

        FindingDetails details = FindingDetails.builder()
                .message(String.format("Shipment outside expected route at (%.4f, %.4f)",
                        point.latitude(), point.longitude()))
                .latitude(point.latitude())
                .longitude(point.longitude())
                .build();

        return Optional.of(ExceptionFinding.builder()
                .shipmentId(snapshot.getShipmentId())
                .type(ExceptionType.GEOFENCE_VIOLATION)
                .severity(Severity.HIGH)
                .details(details)
                .detectedAt(context.getNow())
                .build());
    }
}
