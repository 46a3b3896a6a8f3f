package com.ai.guardrails.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Immutable health snapshot of one model. The tracker swaps whole snapshots,
 * so readers never observe a half-applied probe outcome.
 */
@Value
@Builder(toBuilder = true)
@Schema(description = "Live health state of a registered model")
public class HealthCheck {

    String modelId;

    ModelStatus status;

    @Schema(description = "Latency of the last successful probe; 0 when never probed", example = "120")
    long latencyMs;

    @Schema(description = "Smoothed probe success rate (0.0-1.0)", example = "0.99")
    double successRate;

    Instant lastCheck;

    int consecutiveFailures;

    @Schema(description = "Earliest time an UNAVAILABLE model is probed again; null when not backing off")
    Instant nextProbeAt;

    public static HealthCheck initial(String modelId, Instant now) {
        return HealthCheck.builder()
                .modelId(modelId)
                .status(ModelStatus.HEALTHY)
                .latencyMs(0)
                .successRate(1.0)
                .lastCheck(now)
                .consecutiveFailures(0)
                .build();
    }
}
