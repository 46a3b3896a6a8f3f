package com.ai.guardrails.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Schema(description = "Fused risk verdict over all detectors that fired for one input")
public class RiskAssessmentResult {

    @Schema(description = "Confidence-weighted mean of factor scores (0-100)", example = "83")
    int overallRiskScore;

    @Schema(description = "CRITICAL (>=85), HIGH (>=70), MEDIUM (>=50), LOW (>=30), MINIMAL", example = "HIGH")
    RiskLevel riskLevel;

    @Schema(description = "Factors raised by individual detectors")
    List<RiskFactor> riskFactors;

    @Schema(description = "Deduplicated recommendations, most urgent first (max 5)")
    List<String> recommendations;

    @Schema(description = "True for CRITICAL and HIGH", example = "true")
    boolean shouldBlock;

    @Schema(description = "True for HIGH and MEDIUM", example = "true")
    boolean shouldReview;

    @Builder
    public RiskAssessmentResult(int overallRiskScore, RiskLevel riskLevel, List<RiskFactor> riskFactors,
                                List<String> recommendations, boolean shouldBlock, boolean shouldReview) {
        this.overallRiskScore = overallRiskScore;
        this.riskLevel = riskLevel;
        this.riskFactors = riskFactors == null ? List.of() : List.copyOf(riskFactors);
        this.recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        this.shouldBlock = shouldBlock;
        this.shouldReview = shouldReview;
    }
}
