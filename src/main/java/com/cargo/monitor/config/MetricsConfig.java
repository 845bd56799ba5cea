package com.cargo.monitor.config;

import com.cargo.monitor.model.DispatchStatus;
import com.cargo.monitor.model.ExceptionType;
import com.cargo.monitor.model.RunStatus;
import com.cargo.monitor.model.Severity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger lastRunExceptions;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.lastRunExceptions = registry.gauge("monitor.run.last.exceptions", new AtomicInteger(0));
    }

    public void recordRun(RunStatus status, long durationMs, int exceptionsFound) {
        Counter.builder("monitor.run.count")
                .tag("status", status.name())
                .register(registry)
                .increment();

        Timer.builder("monitor.run.duration")
                .tag("status", status.name())
                .register(registry)
                .record(Duration.ofMillis(durationMs));

        lastRunExceptions.set(exceptionsFound);
    }

    public void recordFinding(ExceptionType type, Severity severity) {
        Counter.builder("monitor.findings.count")
                .tag("type", type.getWireName())
                .tag("severity", severity.getWireName())
                .register(registry)
                .increment();
    }

    public void recordRuleError(ExceptionType type) {
        Counter.builder("monitor.rule.error.count")
                .tag("type", type.getWireName())
                .register(registry)
                .increment();
    }

    public void recordDispatch(DispatchStatus status) {
        Counter.builder("monitor.dispatch.count")
                .tag("status", status.name())
                .register(registry)
                .increment();
    }

    public void recordSkippedTick() {
        Counter.builder("monitor.tick.skipped.count")
                .register(registry)
                .increment();
    }

    public void recordHistoryWriteFailure() {
        Counter.builder("monitor.history.write.failure.count")
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
