package com.ai.guardrails.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger unavailableModels;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.unavailableModels = registry.gauge("model.unavailable.count", new AtomicInteger(0));
    }

    public void recordDecision(String direction, String verdict, int riskScore) {
        Counter.builder("guardrail.decision.count")
                .tag("direction", direction)
                .tag("verdict", verdict)
                .register(registry)
                .increment();

        DistributionSummary.builder("guardrail.risk.score")
                .tag("direction", direction)
                .register(registry)
                .record(riskScore);
    }

    public void recordDetectorFired(String detector) {
        Counter.builder("guardrail.detector.fired")
                .tag("detector", detector)
                .register(registry)
                .increment();
    }

    public void recordThreatDetected(String vectorId) {
        Counter.builder("guardrail.threat.detected")
                .tag("vector", vectorId)
                .register(registry)
                .increment();
    }

    public void recordRoutingDecision(String modelId) {
        Counter.builder("routing.decision.count")
                .tag("model", modelId)
                .register(registry)
                .increment();
    }

    public void recordNoModelAvailable(String capability) {
        Counter.builder("routing.unavailable.count")
                .tag("capability", capability)
                .register(registry)
                .increment();
    }

    public void recordProbe(String modelId, String outcome) {
        Counter.builder("model.probe.count")
                .tag("model", modelId)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordComplianceAudit(String framework, String status) {
        Counter.builder("compliance.audit.count")
                .tag("framework", framework)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void updateUnavailableModelCount(int count) {
        unavailableModels.set(count);
    }
}
