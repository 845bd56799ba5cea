package com.cargo.monitor.engine;

import com.cargo.monitor.model.ExceptionFinding;
import com.cargo.monitor.model.ExceptionType;
import com.cargo.monitor.model.ShipmentSnapshot;

import java.util.Optional;

/**
 * Interface for all exception detection rules.
 * Each implementation owns exactly one ExceptionType and must be a pure function of its inputs.
 */
public interface ExceptionRule {

    /**
     * The exception type this rule emits.
     */
    ExceptionType getSupportedType();

    /**
     * Evaluate one shipment snapshot.
     *
     * @param snapshot the shipment's point-in-time state
     * @param context  run-wide context, including the single {@code now} of the cycle
     * @return a finding when the rule fires, empty otherwise
     */
    Optional<ExceptionFinding> evaluate(ShipmentSnapshot snapshot, EvaluationContext context);
}
