package com.ai.guardrails.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Schema(description = "Final guardrail verdict for one prompt or response")
public class GuardrailDecision {

    @Schema(description = "False only for BLOCK", example = "false")
    boolean allowed;

    @Schema(example = "BLOCK", allowableValues = {"ALLOW", "REVIEW", "BLOCK"})
    Verdict decision;

    RiskAssessmentResult riskAssessment;

    ModerationResult contentModeration;

    @Schema(description = "Matched attack vectors; always empty for responses")
    List<ThreatIntelligence> threatsDetected;

    @Schema(example = "Manual review recommended before processing.")
    String recommendation;

    Map<String, Object> metadata;

    @Schema(description = "Whether a caller-side decision cache may store this outcome")
    public boolean isCacheable() {
        return decision.isCacheable();
    }
}
