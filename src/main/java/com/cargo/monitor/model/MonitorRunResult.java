package com.cargo.monitor.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything one cycle produced: the persisted audit row plus the dispatch trail.
 */
@Value
@Builder
public class MonitorRunResult {

    MonitorRunRecord record;

    List<ExceptionFinding> findings;

    List<DispatchOutcome> outcomes;
}
