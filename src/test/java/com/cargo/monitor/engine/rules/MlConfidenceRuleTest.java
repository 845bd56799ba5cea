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

class MlConfidenceRuleTest {

    private MlConfidenceRule rule;
    private EvaluationContext context;

    @BeforeEach
    void setUp() {
        rule = new MlConfidenceRule(TestDataFactory.defaultConfig());
        context = EvaluationContext.at(NOW);
    }

    @Test
    void evaluate_exactlyThreshold_noFinding() {
        assertThat(rule.evaluate(TestDataFactory.mlFlaggedShipment("S1", 0.70), context)).isEmpty();
    }

    @Test
    void evaluate_justAboveThreshold_medium() {
        Optional<ExceptionFinding> finding = rule.evaluate(TestDataFactory.mlFlaggedShipment("S1", 0.70001), context);

        assertThat(finding).isPresent();
        assertThat(finding.get().getSeverity()).isEqualTo(Severity.MEDIUM);
    }

    @Test
    void evaluate_highConfidence_highWithRiskFactorsInOrder() {
        Optional<ExceptionFinding> finding = rule.evaluate(TestDataFactory.mlFlaggedShipment("S1", 0.86), context);

        assertThat(finding).isPresent();
        assertThat(finding.get().getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(finding.get().getDetails().getMlConfidence()).isEqualTo(0.86);
        assertThat(finding.get().getDetails().getRiskFactors()).containsExactly("port_congestion", "weather");
        assertThat(finding.get().getDetails().getPredictedDelayHours()).isEqualTo(36.0);
    }

    @Test
    void exceedsThreshold_isStrict() {
        assertThat(rule.exceedsThreshold(0.70)).isFalse();
        assertThat(rule.exceedsThreshold(0.70001)).isTrue();
        assertThat(rule.getThreshold()).isEqualTo(0.70);
    }

    @Test
    void evaluate_customThreshold_followsConfig() {
        var config = TestDataFactory.defaultConfig();
        config.getThresholds().setMlConfidence(0.5);
        MlConfidenceRule lowered = new MlConfidenceRule(config);

        assertThat(lowered.evaluate(TestDataFactory.mlFlaggedShipment("S1", 0.6), context)).isPresent();
    }
}
