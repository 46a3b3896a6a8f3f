package com.ai.guardrails.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@Schema(description = "Audit of one framework against the declared system controls")
public class ComplianceAuditResult {

    ComplianceFramework framework;

    @Schema(description = "COMPLIANT with no non-compliant requirement, PARTIAL when the score is at least 0.8, "
            + "otherwise NON_COMPLIANT", example = "PARTIAL")
    ComplianceStatus overallStatus;

    @Schema(description = "Share of fully compliant requirements (0.0-1.0)", example = "0.857")
    double complianceScore;

    int totalRequirements;

    int compliantRequirements;

    int nonCompliantRequirements;

    List<ComplianceCheckResult> checkResults;

    Instant auditTimestamp;
}
