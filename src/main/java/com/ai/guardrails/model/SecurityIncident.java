package com.ai.guardrails.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@Schema(description = "Incident record created when a detected threat is attributable to a subject")
public class SecurityIncident {

    @Schema(example = "INC-4F1A2B3C4D5E")
    String incidentId;

    Instant timestamp;

    @Schema(description = "Identity of the caller that sent the payload", example = "alice@example.com")
    String subject;

    ThreatCategory threatCategory;

    ThreatLevel threatLevel;

    @Schema(description = "Attack vector name", example = "DAN (Do Anything Now)")
    String attackVector;

    @Schema(description = "Payload excerpt, at most 500 characters")
    String payload;

    List<String> detectedBy;

    boolean blocked;

    InvestigationStatus investigationStatus;
}
