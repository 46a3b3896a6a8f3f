package com.ai.guardrails.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Value
@Schema(description = "Content moderation verdict over the toxicity categories")
public class ModerationResult {

    @Schema(description = "Toxicity score reached the active threshold", example = "true")
    boolean toxic;

    @Schema(description = "Maximum category score (0.0-1.0)", example = "1.0")
    double toxicityScore;

    @Schema(description = "SEVERE (>=0.9), HIGH (>=0.7), MODERATE (>=0.5), LOW (>=0.3), CLEAN", example = "SEVERE")
    ToxicityLevel toxicityLevel;

    @Schema(description = "Categories that fired")
    Set<ToxicityCategory> categories;

    @Schema(description = "Distinct matched substrings, in detection order")
    List<String> flaggedContent;

    @Schema(description = "Toxic and SEVERE or HIGH", example = "true")
    boolean shouldBlock;

    @Schema(description = "Content with every flagged span masked; present only when blocking")
    String redactedContent;

    @Builder
    public ModerationResult(boolean toxic, double toxicityScore, ToxicityLevel toxicityLevel,
                            Set<ToxicityCategory> categories, List<String> flaggedContent,
                            boolean shouldBlock, String redactedContent) {
        this.toxic = toxic;
        this.toxicityScore = toxicityScore;
        this.toxicityLevel = toxicityLevel;
        this.categories = categories == null || categories.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(categories));
        this.flaggedContent = flaggedContent == null ? List.of() : List.copyOf(flaggedContent);
        this.shouldBlock = shouldBlock;
        this.redactedContent = redactedContent;
    }
}
