package com.ai.guardrails.service;

import com.ai.guardrails.config.MetricsConfig;
import com.ai.guardrails.exception.InvalidValueException;
import com.ai.guardrails.model.AttackVector;
import com.ai.guardrails.model.AttackVectorStats;
import com.ai.guardrails.model.GuardrailDecision;
import com.ai.guardrails.model.ModerationResult;
import com.ai.guardrails.model.PromptAnalysisRequest;
import com.ai.guardrails.model.ResponseAnalysisRequest;
import com.ai.guardrails.model.RiskAssessmentResult;
import com.ai.guardrails.model.SecurityIncident;
import com.ai.guardrails.model.ThreatIntelligence;
import com.ai.guardrails.model.ThreatReport;
import com.ai.guardrails.model.Verdict;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Entry point for guarding model traffic.
 *
 * Prompt flow:
 * 1. Risk assessment over the prompt detectors
 * 2. Content moderation (strict mode if requested)
 * 3. Attack vector scan
 * 4. Aggregate into ALLOW / REVIEW / BLOCK
 * 5. Record an incident per detected threat when the caller identity is known
 * 6. Record metrics and log blocks
 *
 * Response flow is the same without the attack vector scan.
 */
@Service
public class GuardrailService {

    private static final Logger log = LoggerFactory.getLogger(GuardrailService.class);

    static final List<String> DETECTED_BY = List.of("risk_assessor", "content_moderator", "red_team");

    private final RiskAssessmentService riskAssessmentService;
    private final ContentModerationService contentModerationService;
    private final ThreatIntelligenceService threatIntelligenceService;
    private final ThreatReportService threatReportService;
    private final DecisionAggregator decisionAggregator;
    private final MetricsConfig metricsConfig;

    public GuardrailService(RiskAssessmentService riskAssessmentService,
                            ContentModerationService contentModerationService,
                            ThreatIntelligenceService threatIntelligenceService,
                            ThreatReportService threatReportService,
                            DecisionAggregator decisionAggregator,
                            MetricsConfig metricsConfig) {
        this.riskAssessmentService = riskAssessmentService;
        this.contentModerationService = contentModerationService;
        this.threatIntelligenceService = threatIntelligenceService;
        this.threatReportService = threatReportService;
        this.decisionAggregator = decisionAggregator;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "guardrail.analyze_prompt", contextualName = "analyze-prompt")
    public GuardrailDecision analyzePrompt(PromptAnalysisRequest request) {
        if (request == null || request.getPrompt() == null) {
            throw new InvalidValueException("prompt", "Prompt text is required");
        }
        String prompt = request.getPrompt();

        RiskAssessmentResult risk = riskAssessmentService.assessPrompt(prompt);
        ModerationResult moderation = contentModerationService.moderate(prompt, request.isStrictMode());
        List<ThreatIntelligence> threats = threatIntelligenceService.analyze(prompt, request.getModelId());

        GuardrailDecision decision = decisionAggregator.decidePrompt(risk, moderation, threats);

        String subject = request.getSubject();
        if (!threats.isEmpty() && subject != null && !subject.isBlank()) {
            boolean blocked = decision.getDecision() == Verdict.BLOCK;
            for (ThreatIntelligence threat : threats) {
                threatIntelligenceService.createIncident(subject, threat.getCategory(), threat.getThreatLevel(),
                        threat.getAttackPattern(), prompt, DETECTED_BY, blocked);
            }
        }

        metricsConfig.recordDecision("prompt", decision.getDecision().name(), risk.getOverallRiskScore());
        if (decision.getDecision() == Verdict.BLOCK) {
            log.warn("Prompt blocked: subject={}, model={}, risk={} ({}), toxicity={}, threats={}",
                    subject, request.getModelId(), risk.getOverallRiskScore(), risk.getRiskLevel(),
                    moderation.getToxicityLevel(), threats.size());
        }
        return decision;
    }

    @Observed(name = "guardrail.analyze_response", contextualName = "analyze-response")
    public GuardrailDecision analyzeResponse(ResponseAnalysisRequest request) {
        if (request == null || request.getResponse() == null) {
            throw new InvalidValueException("response", "Response text is required");
        }
        String response = request.getResponse();

        RiskAssessmentResult risk = riskAssessmentService.assessResponse(response);
        ModerationResult moderation = contentModerationService.moderate(response, request.isStrictMode());

        GuardrailDecision decision = decisionAggregator.decideResponse(risk, moderation);

        metricsConfig.recordDecision("response", decision.getDecision().name(), risk.getOverallRiskScore());
        if (decision.getDecision() == Verdict.BLOCK) {
            log.warn("Response blocked: model={}, risk={} ({}), toxicity={}",
                    request.getModelId(), risk.getOverallRiskScore(), risk.getRiskLevel(),
                    moderation.getToxicityLevel());
        }
        return decision;
    }

    public ThreatReport getThreatReport(Instant start, Instant end) {
        return threatReportService.getThreatReport(start, end);
    }

    public List<AttackVector> listAttackVectors() {
        return threatIntelligenceService.listAttackVectors();
    }

    public List<AttackVectorStats> getAttackVectorStats() {
        return threatIntelligenceService.getAttackVectorStats();
    }

    public List<SecurityIncident> getRecentIncidents(int limit) {
        return threatIntelligenceService.getRecentIncidents(limit);
    }
}
