package com.cargo.monitor.engine;

import com.cargo.monitor.config.MetricsConfig;
import com.cargo.monitor.exception.RuleEvaluationException;
import com.cargo.monitor.model.ExceptionFinding;
import com.cargo.monitor.model.FindingKey;
import com.cargo.monitor.model.Severity;
import com.cargo.monitor.model.ShipmentSnapshot;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs every registered rule against every snapshot, then deduplicates and orders the findings.
 *
 * Shipments fan out across the evaluation executor; nothing is returned until every
 * shipment has been evaluated, so the severity ordering covers the whole run.
 */
@Component
public class ExceptionAggregator {

    private static final Logger log = LoggerFactory.getLogger(ExceptionAggregator.class);

    static final Comparator<ExceptionFinding> DISPATCH_ORDER = Comparator
            .comparingInt((ExceptionFinding f) -> f.getSeverity().getRank()).reversed()
            .thenComparing(ExceptionFinding::getShipmentId);

    private final List<ExceptionRule> rules;
    private final Executor executor;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public ExceptionAggregator(List<ExceptionRule> rules,
                               @Qualifier("ruleEvaluationExecutor") Executor executor,
                               Tracer tracer,
                               MetricsConfig metricsConfig) {
        this.rules = List.copyOf(rules);
        this.executor = executor;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        for (ExceptionRule rule : this.rules) {
            log.info("Registered exception rule: {} -> {}",
                    rule.getSupportedType(), rule.getClass().getSimpleName());
        }
    }

    /**
     * Evaluate all rules over all snapshots.
     *
     * @return deduplicated findings, highest severity first, ties by ascending shipment id
     */
    public List<ExceptionFinding> aggregate(List<ShipmentSnapshot> snapshots, EvaluationContext context) {
        List<CompletableFuture<List<ExceptionFinding>>> futures = new ArrayList<>(snapshots.size());
        for (ShipmentSnapshot snapshot : snapshots) {
            futures.add(CompletableFuture.supplyAsync(() -> evaluateShipment(snapshot, context), executor));
        }

        // Barrier: every shipment finishes before dedup and sort
        List<ExceptionFinding> raw = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                raw.addAll(futures.get(i).join());
            } catch (CompletionException e) {
                log.error("Evaluation of shipment {} failed: {}",
                        snapshots.get(i).getShipmentId(), e.getCause().getMessage(), e.getCause());
            }
        }

        List<ExceptionFinding> findings = dedupAndSort(raw);
        for (ExceptionFinding finding : findings) {
            metricsConfig.recordFinding(finding.getType(), finding.getSeverity());
        }
        return findings;
    }

    /**
     * Run each rule once against one shipment, in declaration order. A failing rule is
     * logged and skipped; the other rules still run.
     */
    List<ExceptionFinding> evaluateShipment(ShipmentSnapshot snapshot, EvaluationContext context) {
        List<ExceptionFinding> findings = new ArrayList<>();

        for (ExceptionRule rule : rules) {
            Span ruleSpan = tracer.nextSpan()
                    .name("rule.evaluate." + rule.getSupportedType().getWireName())
                    .tag("shipment.id", String.valueOf(snapshot.getShipmentId()))
                    .tag("rule.type", rule.getSupportedType().name())
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(ruleSpan)) {
                Optional<ExceptionFinding> finding = rule.evaluate(snapshot, context);
                ruleSpan.tag("rule.triggered", String.valueOf(finding.isPresent()));

                if (finding.isPresent()) {
                    findings.add(finding.get());
                    log.debug("Rule {} fired for shipment {}: severity={}, {}",
                            rule.getSupportedType(), snapshot.getShipmentId(),
                            finding.get().getSeverity(), finding.get().getDetails().getMessage());
                }
            } catch (Exception e) {
                RuleEvaluationException failure =
                        new RuleEvaluationException(snapshot.getShipmentId(), rule.getSupportedType(), e);
                ruleSpan.error(failure);
                metricsConfig.recordRuleError(rule.getSupportedType());
                log.error(failure.getMessage(), e);
            } finally {
                ruleSpan.end();
            }
        }

        return findings;
    }

    /**
     * Keep one finding per (shipment, type): the highest severity wins, and on a tie the
     * one that came first. Input order is rule declaration order within each shipment.
     */
    static List<ExceptionFinding> dedupAndSort(List<ExceptionFinding> raw) {
        Map<FindingKey, ExceptionFinding> unique = new LinkedHashMap<>();
        for (ExceptionFinding finding : raw) {
            unique.merge(FindingKey.of(finding), finding, ExceptionAggregator::stronger);
        }

        List<ExceptionFinding> ordered = new ArrayList<>(unique.values());
        ordered.sort(DISPATCH_ORDER);
        return ordered;
    }

    private static ExceptionFinding stronger(ExceptionFinding existing, ExceptionFinding candidate) {
        Severity current = existing.getSeverity();
        return candidate.getSeverity().isHigherThan(current) ? candidate : existing;
    }

    public int getRuleCount() {
        return rules.size();
    }
}
