package com.ai.guardrails.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Controls a deployment declares for a compliance audit. Audit logging is
 * assumed on unless stated otherwise; everything else defaults to absent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Declared security, privacy and AI governance controls of the audited system")
public class SystemControls {

    // Security
    private boolean encryptionEnabled;
    private boolean encryptionAtRest;
    private boolean encryptionInTransit;
    private boolean accessControlEnabled;
    private boolean monitoringEnabled;

    // Logging and audit
    @Builder.Default
    private boolean auditLoggingEnabled = true;
    @Schema(description = "At least 365 days satisfies log retention", example = "365")
    private int auditLogRetentionDays;
    @Builder.Default
    private boolean automaticLogging = true;
    private boolean logReviewProcedures;

    // Privacy
    private boolean consentMechanism;
    private boolean transparency;
    private boolean dataMinimization;
    private boolean privacyByDesign;

    // AI governance
    private boolean riskAssessment;
    private boolean biasDetection;
    private boolean humanOversight;
    private boolean accuracyMetrics;
}
