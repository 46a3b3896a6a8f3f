package com.ai.guardrails.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

@Value
@Builder
public class ModelStats {
    String modelId;
    ModelProvider provider;
    ModelStatus status;
    boolean enabled;
    int priority;
    long latencyMs;
    double successRate;
    int consecutiveFailures;
    Instant lastCheck;
    Set<ModelCapability> capabilities;
    double costPerUnit;
}
