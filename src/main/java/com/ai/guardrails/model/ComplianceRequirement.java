package com.ai.guardrails.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "One control of a compliance framework, checked through its validation rules")
public class ComplianceRequirement {

    @Schema(example = "GDPR-ART-32")
    String requirementId;

    ComplianceFramework framework;

    @Schema(example = "Security of processing")
    String title;

    String description;

    @Schema(description = "False for addressable requirements, which never count as non-compliant")
    boolean mandatory;

    @Schema(example = "Security")
    String controlCategory;

    @Singular
    List<String> validationRules;
}
