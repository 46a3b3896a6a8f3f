package com.ai.guardrails.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "guardrails")
public class GuardrailProperties {

    // Toxicity score at or above which content counts as toxic (default mode).
    private double toxicityThreshold = 0.7;

    // Threshold used when a request asks for strict moderation.
    private double strictToxicityThreshold = 0.5;

    // Evidence lines kept per risk factor.
    private int evidenceLimit = 3;

    // Recommendations kept per risk assessment.
    private int recommendationLimit = 5;

    // Characters of payload stored on an incident.
    private int incidentPayloadLimit = 500;

    // Threat intelligence entries retained in memory; oldest evicted first.
    private int intelligenceLogCapacity = 10_000;

    // Window used by the threat report when no start is given.
    private int defaultReportDays = 7;

    // Register the built-in attack vector and model catalogues at start-up.
    private boolean seedDefaults = true;
}
