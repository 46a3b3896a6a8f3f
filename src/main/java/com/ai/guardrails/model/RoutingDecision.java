package com.ai.guardrails.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Primary model selection plus ordered failover candidates")
public class RoutingDecision {

    @Schema(example = "claude-3-opus")
    String selectedModel;

    ModelProvider provider;

    @Schema(example = "Healthy status; High priority model")
    String reason;

    @Schema(description = "Next best candidates, at most 3")
    List<String> failoverModels;

    long estimatedLatencyMs;

    double estimatedCost;

    @Schema(description = "Routing score of the selected model")
    double score;
}
