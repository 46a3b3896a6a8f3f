package com.ai.guardrails.engine.detectors;

import com.ai.guardrails.engine.RiskDetector;
import com.ai.guardrails.engine.SignatureTable;
import com.ai.guardrails.model.ContentDirection;
import com.ai.guardrails.model.RiskCategory;
import com.ai.guardrails.model.RiskFactor;
import com.ai.guardrails.model.RiskLevel;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Base for risk detectors that fire on the first matching signature and
 * carry fixed severity, score and confidence.
 */
abstract class PatternRiskDetector implements RiskDetector {

    static final int EXCERPT_LENGTH = 50;

    private final RiskCategory category;
    private final Set<ContentDirection> directions;
    private final SignatureTable signatures;
    private final RiskLevel severity;
    private final int score;
    private final double confidence;
    private final String evidenceLabel;
    private final String mitigation;

    protected PatternRiskDetector(RiskCategory category, Set<ContentDirection> directions,
                                  SignatureTable signatures, RiskLevel severity, int score,
                                  double confidence, String evidenceLabel, String mitigation) {
        this.category = category;
        this.directions = Set.copyOf(directions);
        this.signatures = signatures;
        this.severity = severity;
        this.score = score;
        this.confidence = confidence;
        this.evidenceLabel = evidenceLabel;
        this.mitigation = mitigation;
    }

    @Override
    public RiskCategory getCategory() {
        return category;
    }

    @Override
    public Set<ContentDirection> getDirections() {
        return directions;
    }

    @Override
    public Optional<RiskFactor> detect(String content) {
        return signatures.firstMatch(content).map(match -> RiskFactor.builder()
                .category(category)
                .severity(severity)
                .score(score)
                .confidence(confidence)
                .evidence(List.of(evidenceLabel + ": " + excerpt(match)))
                .mitigation(mitigation)
                .build());
    }

    static String excerpt(String match) {
        return match.length() <= EXCERPT_LENGTH ? match : match.substring(0, EXCERPT_LENGTH);
    }
}
