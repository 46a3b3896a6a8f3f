package com.ai.guardrails.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class AttackVectorStats {
    String vectorId;
    String name;
    ThreatCategory category;
    ThreatLevel severity;
    double prevalence;
    int totalIncidents;
    Instant lastSeen;
}
