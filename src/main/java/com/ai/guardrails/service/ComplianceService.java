package com.ai.guardrails.service;

import com.ai.guardrails.config.MetricsConfig;
import com.ai.guardrails.exception.InvalidValueException;
import com.ai.guardrails.model.ComplianceAuditResult;
import com.ai.guardrails.model.ComplianceCheckResult;
import com.ai.guardrails.model.ComplianceFramework;
import com.ai.guardrails.model.ComplianceRequirement;
import com.ai.guardrails.model.ComplianceStatus;
import com.ai.guardrails.model.SystemControls;
import com.ai.guardrails.model.WireEnum;
import com.ai.guardrails.seeder.DefaultComplianceRequirements;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Audits declared system controls against compliance framework requirements.
 *
 * Each requirement passes or fails its validation rules:
 * - every rule passed: COMPLIANT
 * - some rules passed: PARTIAL
 * - none passed: NON_COMPLIANT
 * - addressable (non-mandatory) requirements are never worse than PARTIAL
 *
 * The framework score is the share of COMPLIANT requirements. The framework
 * is COMPLIANT with no NON_COMPLIANT requirement, PARTIAL when the score is at
 * least {@value #PARTIAL_THRESHOLD}, otherwise NON_COMPLIANT.
 *
 * Rules with no automated check are attested outside this system and pass.
 */
@Service
public class ComplianceService {

    private static final Logger log = LoggerFactory.getLogger(ComplianceService.class);

    static final double PARTIAL_THRESHOLD = 0.8;
    static final int LOG_RETENTION_DAYS = 365;

    private static final Map<String, Predicate<SystemControls>> RULE_CHECKS = Map.ofEntries(
            Map.entry("encryption_enabled", SystemControls::isEncryptionEnabled),
            Map.entry("encryption_at_rest", SystemControls::isEncryptionAtRest),
            Map.entry("encryption_in_transit", SystemControls::isEncryptionInTransit),
            Map.entry("access_controls_implemented", SystemControls::isAccessControlEnabled),
            Map.entry("security_monitoring_active", SystemControls::isMonitoringEnabled),
            Map.entry("audit_logging_enabled", SystemControls::isAuditLoggingEnabled),
            Map.entry("log_retention_policy", c -> c.getAuditLogRetentionDays() >= LOG_RETENTION_DAYS),
            Map.entry("automatic_logging", SystemControls::isAutomaticLogging),
            Map.entry("log_review_procedures", SystemControls::isLogReviewProcedures),
            Map.entry("consent_obtained", SystemControls::isConsentMechanism),
            Map.entry("data_subject_informed", SystemControls::isTransparency),
            Map.entry("minimal_data_collection", SystemControls::isDataMinimization),
            Map.entry("privacy_by_design_implemented", SystemControls::isPrivacyByDesign),
            Map.entry("risk_assessment_documented", SystemControls::isRiskAssessment),
            Map.entry("bias_detection_measures", SystemControls::isBiasDetection),
            Map.entry("human_review_capability", SystemControls::isHumanOversight),
            Map.entry("accuracy_metrics_defined", SystemControls::isAccuracyMetrics));

    private final Map<ComplianceFramework, List<ComplianceRequirement>> requirements;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    @Autowired
    public ComplianceService(MetricsConfig metricsConfig, Clock clock) {
        this(DefaultComplianceRequirements.all(), metricsConfig, clock);
    }

    ComplianceService(List<ComplianceRequirement> catalogue, MetricsConfig metricsConfig, Clock clock) {
        Map<ComplianceFramework, List<ComplianceRequirement>> byFramework = new EnumMap<>(ComplianceFramework.class);
        for (ComplianceRequirement requirement : catalogue) {
            byFramework.computeIfAbsent(requirement.getFramework(), k -> new ArrayList<>()).add(requirement);
        }
        byFramework.replaceAll((framework, list) -> List.copyOf(list));
        this.requirements = byFramework;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
        log.info("Loaded {} compliance requirements across {} frameworks", catalogue.size(), byFramework.size());
    }

    public List<ComplianceFramework> listFrameworks() {
        return List.copyOf(requirements.keySet());
    }

    public List<ComplianceRequirement> getRequirements(ComplianceFramework framework) {
        return requireFramework(framework);
    }

    public ComplianceAuditResult audit(String framework, SystemControls controls) {
        return audit(ComplianceFramework.fromValue(framework), controls);
    }

    /**
     * Audit one framework. Null controls audit an undeclared system: only the
     * default-on logging controls are present.
     */
    @Observed(name = "compliance.audit", contextualName = "compliance-audit")
    public ComplianceAuditResult audit(ComplianceFramework framework, SystemControls controls) {
        List<ComplianceRequirement> frameworkRequirements = requireFramework(framework);
        SystemControls declared = controls != null ? controls : SystemControls.builder().build();

        List<ComplianceCheckResult> results = new ArrayList<>(frameworkRequirements.size());
        int compliant = 0;
        int nonCompliant = 0;
        for (ComplianceRequirement requirement : frameworkRequirements) {
            ComplianceCheckResult result = check(requirement, declared);
            results.add(result);
            if (result.getStatus() == ComplianceStatus.COMPLIANT) compliant++;
            if (result.getStatus() == ComplianceStatus.NON_COMPLIANT) nonCompliant++;
        }

        int total = results.size();
        double score = total > 0 ? (double) compliant / total : 0.0;
        ComplianceStatus overall;
        if (nonCompliant == 0) {
            overall = ComplianceStatus.COMPLIANT;
        } else if (score >= PARTIAL_THRESHOLD) {
            overall = ComplianceStatus.PARTIAL;
        } else {
            overall = ComplianceStatus.NON_COMPLIANT;
        }

        metricsConfig.recordComplianceAudit(framework.getValue(), overall.getValue());
        if (overall == ComplianceStatus.NON_COMPLIANT) {
            log.warn("Compliance audit {}: NON_COMPLIANT, score={}, failing requirements={}",
                    framework, String.format("%.2f", score), nonCompliant);
        } else {
            log.info("Compliance audit {}: {}, score={}", framework, overall, String.format("%.2f", score));
        }

        return ComplianceAuditResult.builder()
                .framework(framework)
                .overallStatus(overall)
                .complianceScore(score)
                .totalRequirements(total)
                .compliantRequirements(compliant)
                .nonCompliantRequirements(nonCompliant)
                .checkResults(List.copyOf(results))
                .auditTimestamp(Instant.now(clock))
                .build();
    }

    /**
     * Audit several frameworks against the same controls, keyed in request order.
     */
    public Map<ComplianceFramework, ComplianceAuditResult> report(List<ComplianceFramework> frameworks,
                                                                  SystemControls controls) {
        if (frameworks == null || frameworks.isEmpty()) {
            throw new InvalidValueException("frameworks", "At least one framework is required");
        }
        Map<ComplianceFramework, ComplianceAuditResult> report = new LinkedHashMap<>();
        for (ComplianceFramework framework : frameworks) {
            report.computeIfAbsent(framework, f -> audit(f, controls));
        }
        return report;
    }

    ComplianceCheckResult check(ComplianceRequirement requirement, SystemControls controls) {
        List<String> evidence = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        int passed = 0;
        for (String rule : requirement.getValidationRules()) {
            if (RULE_CHECKS.getOrDefault(rule, c -> true).test(controls)) {
                passed++;
                evidence.add("Rule '" + rule + "' passed");
            } else {
                evidence.add("Rule '" + rule + "' failed");
                recommendations.add("Implement or fix: " + rule);
            }
        }

        int total = requirement.getValidationRules().size();
        ComplianceStatus status;
        String details;
        if (passed == total) {
            status = ComplianceStatus.COMPLIANT;
            details = "All validation rules passed";
        } else if (passed > 0) {
            status = ComplianceStatus.PARTIAL;
            details = passed + "/" + total + " validation rules passed";
        } else {
            status = ComplianceStatus.NON_COMPLIANT;
            details = "No validation rules passed";
        }
        if (!requirement.isMandatory() && status != ComplianceStatus.COMPLIANT) {
            status = ComplianceStatus.PARTIAL;
            details += " (addressable requirement)";
        }

        return ComplianceCheckResult.builder()
                .requirementId(requirement.getRequirementId())
                .status(status)
                .details(details)
                .evidence(List.copyOf(evidence))
                .recommendations(List.copyOf(recommendations))
                .build();
    }

    private List<ComplianceRequirement> requireFramework(ComplianceFramework framework) {
        List<ComplianceRequirement> found = framework != null ? requirements.get(framework) : null;
        if (found == null) {
            List<String> known = requirements.keySet().stream().map(WireEnum::getValue).toList();
            throw new InvalidValueException("framework", framework == null ? null : framework.getValue(), known);
        }
        return found;
    }
}
