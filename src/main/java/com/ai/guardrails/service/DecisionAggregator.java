package com.ai.guardrails.service;

import com.ai.guardrails.model.GuardrailDecision;
import com.ai.guardrails.model.ModerationResult;
import com.ai.guardrails.model.RiskAssessmentResult;
import com.ai.guardrails.model.ThreatIntelligence;
import com.ai.guardrails.model.Verdict;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Combines risk, moderation and threat verdicts into ALLOW / REVIEW / BLOCK.
 *
 * BLOCK when risk or moderation blocks, or any threat is CRITICAL or HIGH.
 * Otherwise REVIEW when risk asks for review, or content is toxic without
 * being blocked. Otherwise ALLOW.
 */
@Component
public class DecisionAggregator {

    public Verdict verdict(RiskAssessmentResult risk, ModerationResult moderation, List<ThreatIntelligence> threats) {
        boolean threatBlocks = threats.stream().anyMatch(t -> t.getThreatLevel().isBlocking());
        if (risk.isShouldBlock() || moderation.isShouldBlock() || threatBlocks) {
            return Verdict.BLOCK;
        }
        if (risk.isShouldReview() || (moderation.isToxic() && !moderation.isShouldBlock())) {
            return Verdict.REVIEW;
        }
        return Verdict.ALLOW;
    }

    public GuardrailDecision decidePrompt(RiskAssessmentResult risk, ModerationResult moderation,
                                          List<ThreatIntelligence> threats) {
        Verdict verdict = verdict(risk, moderation, threats);

        String recommendation;
        if (verdict == Verdict.BLOCK) {
            StringBuilder sb = new StringBuilder("Request blocked due to security risks.");
            if (risk.isShouldBlock()) {
                sb.append(" Risk: ").append(risk.getRiskLevel().getValue()).append('.');
            }
            if (moderation.isShouldBlock()) {
                sb.append(" Content: ").append(moderation.getToxicityLevel().getValue()).append('.');
            }
            if (!threats.isEmpty()) {
                sb.append(" Threats: ")
                        .append(threats.stream().map(ThreatIntelligence::getAttackPattern).collect(Collectors.joining(", ")))
                        .append('.');
            }
            recommendation = sb.toString();
        } else if (verdict == Verdict.REVIEW) {
            recommendation = "Manual review recommended before processing.";
        } else {
            recommendation = "Prompt passes all security checks.";
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("overall_risk_score", risk.getOverallRiskScore());
        metadata.put("toxicity_score", moderation.getToxicityScore());
        metadata.put("threat_count", threats.size());

        return build(verdict, risk, moderation, threats, recommendation, metadata);
    }

    public GuardrailDecision decideResponse(RiskAssessmentResult risk, ModerationResult moderation) {
        Verdict verdict = verdict(risk, moderation, List.of());
        boolean redactedAvailable = moderation.getRedactedContent() != null;

        String recommendation;
        if (verdict == Verdict.BLOCK) {
            recommendation = redactedAvailable
                    ? "Response blocked. Consider using redacted version."
                    : "Response blocked due to security/compliance violations.";
        } else if (verdict == Verdict.REVIEW) {
            recommendation = "Response requires review before delivery.";
        } else {
            recommendation = "Response passes all security checks.";
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("overall_risk_score", risk.getOverallRiskScore());
        metadata.put("toxicity_score", moderation.getToxicityScore());
        metadata.put("redacted_available", redactedAvailable);

        return build(verdict, risk, moderation, List.of(), recommendation, metadata);
    }

    private static GuardrailDecision build(Verdict verdict, RiskAssessmentResult risk, ModerationResult moderation,
                                           List<ThreatIntelligence> threats, String recommendation,
                                           Map<String, Object> metadata) {
        return GuardrailDecision.builder()
                .allowed(verdict != Verdict.BLOCK)
                .decision(verdict)
                .riskAssessment(risk)
                .contentModeration(moderation)
                .threatsDetected(List.copyOf(threats))
                .recommendation(recommendation)
                .metadata(Collections.unmodifiableMap(metadata))
                .build();
    }
}
