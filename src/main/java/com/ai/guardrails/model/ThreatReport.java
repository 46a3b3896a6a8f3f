package com.ai.guardrails.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
@Schema(description = "Batch rollup of incidents within a time window")
public class ThreatReport {

    @Schema(example = "RPT-20240301120000")
    String reportId;

    Instant generatedAt;

    Instant periodStart;

    Instant periodEnd;

    int totalThreatsDetected;

    Map<ThreatCategory, Integer> threatsByCategory;

    Map<ThreatLevel, Integer> threatsByLevel;

    @Schema(description = "Attack vector names ranked by incident count (max 10)")
    List<String> topAttackVectors;

    int blockedAttacks;

    @Schema(description = "Incidents that were not blocked")
    int unblockedAttacks;

    List<String> recommendations;

    @Schema(description = "Vectors whose incident count grew from the first to the second half of the window")
    List<String> trendingThreats;
}
