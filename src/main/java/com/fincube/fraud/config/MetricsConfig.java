package com.fincube.fraud.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger referenceVectorCount;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.referenceVectorCount = registry.gauge("reference.vectors", new AtomicInteger(0));
    }

    public void recordScoring(String label, double confidence) {
        Counter.builder("scoring.count")
                .tag("label", label)
                .register(registry)
                .increment();

        DistributionSummary.builder("scoring.confidence")
                .tag("label", label)
                .register(registry)
                .record(confidence);
    }

    public void recordScoringRejected() {
        Counter.builder("scoring.rejected.count")
                .register(registry)
                .increment();
    }

    public void recordPatternTriggered(String tag) {
        Counter.builder("pattern.triggered.count")
                .tag("tag", tag)
                .register(registry)
                .increment();
    }

    public void recordOracleCall(String outcome) {
        Counter.builder("oracle.call.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordGuardrailOverride(String rule) {
        Counter.builder("guardrail.override.count")
                .tag("rule", rule)
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

    public void updateReferenceVectorCount(int count) {
        referenceVectorCount.set(count);
    }
}
