package com.cargo.monitor.model;

/**
 * Identity of a finding within one run.
 */
public record FindingKey(String shipmentId, ExceptionType type) {

    public static FindingKey of(ExceptionFinding finding) {
        return new FindingKey(finding.getShipmentId(), finding.getType());
    }
}
