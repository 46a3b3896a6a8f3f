package com.ai.guardrails.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

@Value
@Builder(toBuilder = true)
@Schema(description = "Static routing metadata for a registered backend model")
public class ModelConfig {

    @Schema(description = "Unique model identifier", example = "claude-3-sonnet")
    String modelId;

    @Schema(example = "anthropic")
    ModelProvider provider;

    @Schema(example = "https://api.anthropic.com/v1/messages")
    String endpoint;

    @Schema(description = "Name of the environment variable holding the provider key", example = "ANTHROPIC_API_KEY")
    String apiKeyEnv;

    @Singular
    Set<ModelCapability> capabilities;

    @Builder.Default
    int maxTokens = 4096;

    @Schema(description = "Cost per 1k tokens", example = "0.003")
    @Builder.Default
    double costPerUnit = 0.0;

    @Builder.Default
    long latencyThresholdMs = 5000;

    @Schema(description = "Routing priority (0-100), higher is preferred", example = "85")
    @Builder.Default
    int priority = 100;

    @Builder.Default
    boolean enabled = true;

    public boolean supports(ModelCapability capability) {
        return capabilities.contains(capability);
    }
}
