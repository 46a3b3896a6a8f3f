package com.ai.guardrails.service;

import com.ai.guardrails.config.GuardrailProperties;
import com.ai.guardrails.engine.DetectorEngine;
import com.ai.guardrails.model.ContentDirection;
import com.ai.guardrails.model.RiskAssessmentResult;
import com.ai.guardrails.model.RiskCategory;
import com.ai.guardrails.model.RiskFactor;
import com.ai.guardrails.model.RiskLevel;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fuses risk factors into a single assessment.
 *
 * Overall score = round(Σ(score × confidence) / Σ(confidence)) over the fired
 * factors, so low-confidence detectors pull the result less than confident
 * ones. No factors means score 0 and level MINIMAL.
 */
@Service
public class RiskAssessmentService {

    static final String NO_RISK_RECOMMENDATION = "No significant risks detected";

    private static final Map<RiskCategory, List<String>> CATEGORY_RECOMMENDATIONS = new EnumMap<>(RiskCategory.class);

    static {
        CATEGORY_RECOMMENDATIONS.put(RiskCategory.DATA_LEAKAGE, List.of(
                "Enable DLP scanning and PII redaction",
                "Implement data loss prevention policies"));
        CATEGORY_RECOMMENDATIONS.put(RiskCategory.JAILBREAK_ATTEMPT, List.of(
                "Apply input sanitization and validation",
                "Enable advanced prompt protection"));
        CATEGORY_RECOMMENDATIONS.put(RiskCategory.PROMPT_INJECTION, List.of(
                "Apply input sanitization and validation",
                "Enable advanced prompt protection"));
        CATEGORY_RECOMMENDATIONS.put(RiskCategory.HARMFUL_OUTPUT, List.of(
                "Enable content moderation filters",
                "Implement human review for flagged content"));
        CATEGORY_RECOMMENDATIONS.put(RiskCategory.COMPLIANCE_VIOLATION, List.of(
                "Review compliance requirements (GDPR, HIPAA, etc.)",
                "Ensure proper data classification and handling"));
        CATEGORY_RECOMMENDATIONS.put(RiskCategory.BIAS_DISCRIMINATION, List.of(
                "Audit model outputs for biased or discriminatory statements"));
    }

    private final DetectorEngine detectorEngine;
    private final GuardrailProperties properties;

    public RiskAssessmentService(DetectorEngine detectorEngine, GuardrailProperties properties) {
        this.detectorEngine = detectorEngine;
        this.properties = properties;
    }

    public RiskAssessmentResult assessPrompt(String prompt) {
        return computeResult(detectorEngine.detectRisks(prompt, ContentDirection.PROMPT));
    }

    public RiskAssessmentResult assessResponse(String response) {
        return computeResult(detectorEngine.detectRisks(response, ContentDirection.RESPONSE));
    }

    public RiskAssessmentResult computeResult(List<RiskFactor> factors) {
        double weightedScoreSum = 0.0;
        double confidenceSum = 0.0;
        for (RiskFactor factor : factors) {
            weightedScoreSum += factor.getScore() * factor.getConfidence();
            confidenceSum += factor.getConfidence();
        }

        int overallScore = confidenceSum > 0
                ? (int) Math.min(100, Math.round(weightedScoreSum / confidenceSum))
                : 0;
        RiskLevel level = RiskLevel.fromScore(overallScore);

        return RiskAssessmentResult.builder()
                .overallRiskScore(overallScore)
                .riskLevel(level)
                .riskFactors(factors)
                .recommendations(recommendations(factors, level))
                .shouldBlock(level == RiskLevel.CRITICAL || level == RiskLevel.HIGH)
                .shouldReview(level == RiskLevel.HIGH || level == RiskLevel.MEDIUM)
                .build();
    }

    /**
     * Level-wide advice first, then category advice ordered by the most
     * severe factor in each category.
     */
    private List<String> recommendations(List<RiskFactor> factors, RiskLevel level) {
        if (factors.isEmpty()) {
            return List.of(NO_RISK_RECOMMENDATION);
        }

        Set<String> recs = new LinkedHashSet<>();
        if (level == RiskLevel.CRITICAL) {
            recs.add("IMMEDIATE ACTION REQUIRED: Block request and alert security team");
        } else if (level == RiskLevel.HIGH) {
            recs.add("Require manual review before proceeding");
        } else if (level == RiskLevel.MEDIUM) {
            recs.add("Log for audit and consider additional monitoring");
        }

        // RiskLevel is declared most severe first, so a lower ordinal is more urgent
        Map<RiskCategory, RiskLevel> worstByCategory = new EnumMap<>(RiskCategory.class);
        for (RiskFactor factor : factors) {
            worstByCategory.merge(factor.getCategory(), factor.getSeverity(),
                    (a, b) -> a.ordinal() <= b.ordinal() ? a : b);
        }
        List<RiskCategory> ordered = new ArrayList<>(worstByCategory.keySet());
        ordered.sort(Comparator.comparing(worstByCategory::get));

        for (RiskCategory category : ordered) {
            recs.addAll(CATEGORY_RECOMMENDATIONS.getOrDefault(category, List.of()));
        }

        return recs.stream().limit(properties.getRecommendationLimit()).toList();
    }
}
