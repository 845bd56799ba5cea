package com.cargo.monitor.exception;

import com.cargo.monitor.model.ExceptionType;

/**
 * One rule failed for one shipment. Logged and skipped.
 */
public class RuleEvaluationException extends MonitorException {

    private final String shipmentId;
    private final ExceptionType type;

    public RuleEvaluationException(String shipmentId, ExceptionType type, Throwable cause) {
        super("Rule " + type + " failed for shipment " + shipmentId + ": " + cause.getMessage(), cause);
        this.shipmentId = shipmentId;
        this.type = type;
    }

    public String getShipmentId() {
        return shipmentId;
    }

    public ExceptionType getType() {
        return type;
    }
}
