package com.bank.aml.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger loopState;
    private final AtomicInteger lastBatchSize;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.loopState = registry.gauge("monitor.loop.state", new AtomicInteger(0));
        this.lastBatchSize = registry.gauge("monitor.pass.batch_size", new AtomicInteger(0));
    }

    public void recordPass(String outcome, int batchSize, long durationMs) {
        Counter.builder("monitor.pass.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();

        Timer.builder("monitor.pass.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(durationMs));

        lastBatchSize.set(batchSize);
    }

    public void recordRuleFlagged(String ruleTag, int count) {
        Counter.builder("rule.flagged.count")
                .tag("rule_tag", ruleTag)
                .register(registry)
                .increment(count);
    }

    public void recordAlert(String riskLevel) {
        Counter.builder("alert.recorded.count")
                .tag("risk_level", riskLevel)
                .register(registry)
                .increment();
    }

    public void recordAlertFailure() {
        Counter.builder("alert.failed.count")
                .register(registry)
                .increment();
    }

    public void recordValidationWarnings(int count) {
        Counter.builder("validation.warning.count")
                .register(registry)
                .increment(count);
    }

    public void recordGraphSkipped() {
        Counter.builder("graph.analysis.skipped.count")
                .register(registry)
                .increment();
    }

    public void recordArchived(int count) {
        Counter.builder("archive.moved.count")
                .register(registry)
                .increment(count);
    }

    public void recordArchiveFailure() {
        Counter.builder("archive.failed.count")
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

    public void updateLoopState(int ordinal) {
        loopState.set(ordinal);
    }
}
