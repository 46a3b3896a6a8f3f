package com.ai.guardrails.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Schema(description = "A single risk signal raised by one detector")
public class RiskFactor {

    @Schema(description = "Risk category of the detector that fired", example = "DATA_LEAKAGE")
    RiskCategory category;

    @Schema(description = "Fixed severity of the finding", example = "CRITICAL")
    RiskLevel severity;

    @Schema(description = "Risk score contribution (0-100)", example = "90")
    int score;

    @Schema(description = "Detector confidence (0.0-1.0), used as the fusion weight", example = "0.95")
    double confidence;

    @Schema(description = "Bounded list of human-readable evidence lines",
            example = "[\"Detected ssn: 1 occurrence(s)\"]")
    List<String> evidence;

    @Schema(description = "Suggested mitigation", example = "Remove or redact ssn before processing")
    String mitigation;

    @Builder
    public RiskFactor(RiskCategory category, RiskLevel severity, int score, double confidence,
                      List<String> evidence, String mitigation) {
        if (category == null || severity == null) {
            throw new IllegalArgumentException("Risk factor requires category and severity");
        }
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("Risk factor score out of range [0,100]: " + score);
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Risk factor confidence out of range [0,1]: " + confidence);
        }
        this.category = category;
        this.severity = severity;
        this.score = score;
        this.confidence = confidence;
        this.evidence = evidence == null ? List.of() : List.copyOf(evidence);
        this.mitigation = mitigation;
    }
}
