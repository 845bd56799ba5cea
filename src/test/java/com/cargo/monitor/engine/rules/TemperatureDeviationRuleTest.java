package com.cargo.monitor.engine.rules;

import com.cargo.monitor.engine.EvaluationContext;
import com.cargo.monitor.model.ExceptionFinding;
import com.cargo.monitor.model.Severity;
import com.cargo.monitor.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.cargo.monitor.testutil.TestDataFactory.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TemperatureDeviationRuleTest {

    private TemperatureDeviationRule rule;
    private EvaluationContext context;

    @BeforeEach
    void setUp() {
        rule = new TemperatureDeviationRule(TestDataFactory.defaultConfig());
        context = EvaluationContext.at(NOW);
    }

    @Test
    void evaluate_noTelemetry_noFinding() {
        assertThat(rule.evaluate(TestDataFactory.quietShipment("S1").build(), context)).isEmpty();
    }

    @Test
    void evaluate_withinTolerance_noFinding() {
        assertThat(rule.evaluate(TestDataFactory.reeferShipment("S1", -15.5, -18.0), context)).isEmpty();
    }

    @Test
    void evaluate_exactlyAtThreshold_noFinding() {
        assertThat(rule.evaluate(TestDataFactory.reeferShipment("S1", -13.0, -18.0), context)).isEmpty();
        assertThat(rule.evaluate(TestDataFactory.reeferShipment("S1", -23.0, -18.0), context)).isEmpty();
    }

    @Test
    void evaluate_exactlyAtHighThreshold_medium() {
        Optional<ExceptionFinding> finding = rule.evaluate(TestDataFactory.reeferShipment("S1", -8.0, -18.0), context);

        assertThat(finding).isPresent();
        assertThat(finding.get().getSeverity()).isEqualTo(Severity.MEDIUM);
    }

    @Test
    void evaluate_justAboveHighThreshold_high() {
        Optional<ExceptionFinding> finding = rule.evaluate(TestDataFactory.reeferShipment("S1", -7.5, -18.0), context);

        assertThat(finding).isPresent();
        assertThat(finding.get().getSeverity()).isEqualTo(Severity.HIGH);
    }

    @Test
    void evaluate_warmDrift_medium() {
        Optional<ExceptionFinding> finding = rule.evaluate(TestDataFactory.reeferShipment("S1", -11.0, -18.0), context);

        assertThat(finding).isPresent();
        assertThat(finding.get().getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(finding.get().getDetails().getDeviationCelsius()).isCloseTo(7.0, within(0.0001));
        assertThat(finding.get().getDetails().getContainerId()).isEqualTo("MSCU1234567");
    }

    @Test
    void evaluate_coldDrift_countsAbsoluteDeviation() {
        Optional<ExceptionFinding> finding = rule.evaluate(TestDataFactory.reeferShipment("S1", -30.0, -18.0), context);

        assertThat(finding).isPresent();
        assertThat(finding.get().getSeverity()).isEqualTo(Severity.HIGH);
    }
}
