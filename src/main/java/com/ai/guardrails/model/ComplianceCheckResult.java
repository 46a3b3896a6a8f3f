package com.ai.guardrails.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Outcome of checking a single requirement")
public class ComplianceCheckResult {

    String requirementId;

    ComplianceStatus status;

    @Schema(example = "2/3 validation rules passed")
    String details;

    @Schema(description = "One line per validation rule, passed or failed")
    List<String> evidence;

    @Schema(description = "One entry per failed rule")
    List<String> recommendations;
}
