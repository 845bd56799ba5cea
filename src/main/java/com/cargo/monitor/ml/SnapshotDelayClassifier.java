package com.cargo.monitor.ml;

import com.cargo.monitor.model.DelayPrediction;
import com.cargo.monitor.model.ShipmentSnapshot;
import com.cargo.monitor.repository.ShipmentSnapshotProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Reads the prediction the upstream model already attached to the shipment record.
 * Replace this bean to call a live model instead.
 */
@Component
public class SnapshotDelayClassifier implements DelayClassifier {

    private static final Logger log = LoggerFactory.getLogger(SnapshotDelayClassifier.class);

    // Positive class cut-off of the upstream binary classifier
    static final double POSITIVE_CLASS_PROBABILITY = 0.5;

    private final ShipmentSnapshotProvider snapshotProvider;
    private final Clock clock;

    public SnapshotDelayClassifier(ShipmentSnapshotProvider snapshotProvider, Clock clock) {
        this.snapshotProvider = snapshotProvider;
        this.clock = clock;
    }

    @Override
    public Optional<DelayPrediction> predict(String shipmentId) {
        Optional<ShipmentSnapshot> snapshot = snapshotProvider.findActiveShipment(shipmentId, clock.instant());
        if (snapshot.isEmpty()) {
            log.debug("No active shipment {} to predict for", shipmentId);
            return Optional.empty();
        }

        ShipmentSnapshot s = snapshot.get();
        return Optional.of(DelayPrediction.builder()
                .willDelay(s.getMlDelayConfidence() >= POSITIVE_CLASS_PROBABILITY)
                .confidence(s.getMlDelayConfidence())
                .riskFactors(s.getMlRiskFactors())
                .predictedDelayHours(s.getPredictedDelayHours().orElse(0.0))
                .build());
    }
}
