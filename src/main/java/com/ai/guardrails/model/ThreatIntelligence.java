package com.ai.guardrails.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@Schema(description = "One attack vector matched against one input")
public class ThreatIntelligence {

    @Schema(description = "Hash of content excerpt, vector id and detection time", example = "3f9a0c1b2d4e5f60")
    String threatId;

    Instant timestamp;

    @Schema(example = "red_team_detection")
    String source;

    ThreatLevel threatLevel;

    ThreatCategory category;

    @Schema(description = "Signatures of the vector that matched")
    List<String> indicators;

    List<String> affectedModels;

    @Schema(description = "Name of the matched attack vector", example = "System Prompt Extraction")
    String attackPattern;

    List<String> recommendedActions;
}
