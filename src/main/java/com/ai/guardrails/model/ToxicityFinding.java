package com.ai.guardrails.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Output of one toxicity detector: its category score plus every substring
 * it matched (used for the flagged list and for redaction).
 */
@Value
public class ToxicityFinding {

    ToxicityCategory category;
    double score;
    List<String> matches;

    @Builder
    public ToxicityFinding(ToxicityCategory category, double score, List<String> matches) {
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Toxicity score out of range [0,1]: " + score);
        }
        this.category = category;
        this.score = score;
        this.matches = matches == null ? List.of() : List.copyOf(matches);
    }
}
