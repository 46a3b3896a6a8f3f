package com.ai.guardrails.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A named, signature-backed adversarial pattern. Everything except
 * {@code lastSeen} is fixed at registration.
 */
@Getter
@Schema(description = "Known attack vector with its detection signatures")
public class AttackVector {

    @Schema(description = "Unique vector identifier", example = "PRMPT-INJ-001")
    private final String vectorId;

    @Schema(description = "Display name", example = "Direct Instruction Override")
    private final String name;

    @Schema(description = "Threat category", example = "PROMPT_INJECTION")
    private final ThreatCategory category;

    private final String description;

    @Schema(description = "Fixed severity attached to every match", example = "HIGH")
    private final ThreatLevel severity;

    @Schema(description = "Regular expressions, matched case-insensitively")
    private final List<String> detectionSignatures;

    private final List<String> mitigationStrategies;

    private final List<String> examples;

    private final LocalDate discoveredDate;

    @Schema(description = "Observed prevalence (0.0-1.0)", example = "0.85")
    private final double prevalenceScore;

    @Getter(AccessLevel.NONE)
    private final AtomicReference<Instant> lastSeen = new AtomicReference<>();

    @Builder
    public AttackVector(String vectorId, String name, ThreatCategory category, String description,
                        ThreatLevel severity, List<String> detectionSignatures,
                        List<String> mitigationStrategies, List<String> examples,
                        LocalDate discoveredDate, double prevalenceScore) {
        if (vectorId == null || vectorId.isBlank()) {
            throw new IllegalArgumentException("Attack vector requires an id");
        }
        if (prevalenceScore < 0.0 || prevalenceScore > 1.0) {
            throw new IllegalArgumentException("Prevalence out of range [0,1]: " + prevalenceScore);
        }
        this.vectorId = vectorId;
        this.name = name;
        this.category = category;
        this.description = description;
        this.severity = severity;
        this.detectionSignatures = detectionSignatures == null ? List.of() : List.copyOf(detectionSignatures);
        this.mitigationStrategies = mitigationStrategies == null ? List.of() : List.copyOf(mitigationStrategies);
        this.examples = examples == null ? List.of() : List.copyOf(examples);
        this.discoveredDate = discoveredDate;
        this.prevalenceScore = prevalenceScore;
    }

    @Schema(description = "Latest time any signature of this vector matched")
    public Instant getLastSeen() {
        return lastSeen.get();
    }

    /**
     * Records a match. Concurrent scans may report out of order; the latest
     * instant wins.
     */
    public void markSeen(Instant when) {
        if (when == null) {
            return;
        }
        lastSeen.accumulateAndGet(when, (prev, next) -> prev == null || next.isAfter(prev) ? next : prev);
    }
}
