package com.cargo.monitor.engine;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Run-wide values shared by every rule in one cycle. {@code now} is captured once
 * so all shipments are judged against the same instant.
 */
@Value
@Builder
public class EvaluationContext {

    String runId;

    Instant now;

    public static EvaluationContext at(Instant now) {
        return EvaluationContext.builder().runId("adhoc").now(now).build();
    }
}
