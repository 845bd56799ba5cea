package com.cargo.monitor.ml;

import com.cargo.monitor.model.DelayPrediction;

import java.util.Optional;

/**
 * Black-box delay classifier. Returns empty when it has nothing to say about the shipment.
 */
public interface DelayClassifier {

    Optional<DelayPrediction> predict(String shipmentId);
}
