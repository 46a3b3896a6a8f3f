package com.ai.guardrails.seeder;

import com.ai.guardrails.model.ComplianceFramework;
import com.ai.guardrails.model.ComplianceRequirement;

import java.util.List;

/**
 * Built-in requirement catalogue per compliance framework, in audit order.
 */
public final class DefaultComplianceRequirements {

    private DefaultComplianceRequirements() {}

    public static List<ComplianceRequirement> all() {
        return List.of(
                requirement(ComplianceFramework.GDPR, "GDPR-ART-5-1-A", "Lawfulness, fairness and transparency",
                        "Personal data must be processed lawfully, fairly and transparently",
                        true, "Data Processing Principles",
                        "consent_obtained", "processing_purpose_specified", "data_subject_informed"),
                requirement(ComplianceFramework.GDPR, "GDPR-ART-5-1-B", "Purpose limitation",
                        "Data collected for specified, explicit and legitimate purposes",
                        true, "Data Processing Principles",
                        "purpose_documented", "no_incompatible_processing"),
                requirement(ComplianceFramework.GDPR, "GDPR-ART-5-1-C", "Data minimization",
                        "Data must be adequate, relevant and limited to what is necessary",
                        true, "Data Processing Principles",
                        "minimal_data_collection", "no_excessive_data"),
                requirement(ComplianceFramework.GDPR, "GDPR-ART-6", "Lawful basis for processing",
                        "Processing must have a lawful basis such as consent, contract or legal obligation",
                        true, "Lawfulness",
                        "lawful_basis_identified", "consent_or_legitimate_interest"),
                requirement(ComplianceFramework.GDPR, "GDPR-ART-25", "Data protection by design and by default",
                        "Implement appropriate technical and organizational measures",
                        true, "Privacy by Design",
                        "privacy_by_design_implemented", "default_settings_protective"),
                requirement(ComplianceFramework.GDPR, "GDPR-ART-32", "Security of processing",
                        "Implement appropriate security measures including encryption",
                        true, "Security",
                        "encryption_enabled", "access_controls_implemented", "security_monitoring_active"),
                requirement(ComplianceFramework.GDPR, "GDPR-ART-33-34", "Breach notification",
                        "Notify authorities and data subjects of breaches within 72 hours",
                        true, "Incident Response",
                        "breach_detection_capability", "notification_procedures_documented"),
                requirement(ComplianceFramework.HIPAA, "HIPAA-164-308-A-1", "Security Management Process",
                        "Implement policies and procedures to prevent, detect, contain, and correct security violations",
                        true, "Administrative Safeguards",
                        "risk_analysis_performed", "risk_management_strategy", "security_incident_procedures"),
                requirement(ComplianceFramework.HIPAA, "HIPAA-164-308-A-3", "Workforce Security",
                        "Implement procedures to ensure workforce access to ePHI is appropriate",
                        true, "Administrative Safeguards",
                        "authorization_procedures", "workforce_clearance", "termination_procedures"),
                requirement(ComplianceFramework.HIPAA, "HIPAA-164-312-A-1", "Access Control",
                        "Implement technical policies to allow only authorized access to ePHI",
                        true, "Technical Safeguards",
                        "unique_user_identification", "automatic_logoff", "encryption_decryption"),
                requirement(ComplianceFramework.HIPAA, "HIPAA-164-312-A-2-IV", "Encryption and Decryption",
                        "Implement mechanism to encrypt and decrypt ePHI",
                        false, "Technical Safeguards",
                        "encryption_at_rest", "encryption_in_transit"),
                requirement(ComplianceFramework.HIPAA, "HIPAA-164-312-B", "Audit Controls",
                        "Implement hardware, software, and procedures to record and examine access to ePHI",
                        true, "Technical Safeguards",
                        "audit_logging_enabled", "log_retention_policy", "log_review_procedures"),
                requirement(ComplianceFramework.HIPAA, "HIPAA-164-312-E-1", "Transmission Security",
                        "Implement technical security measures to guard against unauthorized access during transmission",
                        true, "Technical Safeguards",
                        "integrity_controls", "encryption_in_transit"),
                requirement(ComplianceFramework.EUAIA, "EUAIA-ART-9", "Risk Management System",
                        "High-risk AI systems must have a risk management system",
                        true, "Risk Management",
                        "risk_assessment_documented", "risk_mitigation_measures", "continuous_risk_monitoring"),
                requirement(ComplianceFramework.EUAIA, "EUAIA-ART-10", "Data and Data Governance",
                        "Training, validation and testing data must be relevant, representative, free of errors",
                        true, "Data Governance",
                        "data_quality_criteria", "bias_detection_measures", "data_documentation"),
                requirement(ComplianceFramework.EUAIA, "EUAIA-ART-11", "Technical Documentation",
                        "Maintain technical documentation demonstrating compliance",
                        true, "Documentation",
                        "comprehensive_documentation", "documentation_accessible", "documentation_updated"),
                requirement(ComplianceFramework.EUAIA, "EUAIA-ART-12", "Record-keeping",
                        "Automatically record events throughout the AI system's lifetime",
                        true, "Logging and Monitoring",
                        "automatic_logging", "log_retention", "traceability_maintained"),
                requirement(ComplianceFramework.EUAIA, "EUAIA-ART-13", "Transparency and provision of information to users",
                        "High-risk AI systems must be transparent and provide information to users",
                        true, "Transparency",
                        "user_information_provided", "ai_interaction_disclosed", "clear_instructions"),
                requirement(ComplianceFramework.EUAIA, "EUAIA-ART-14", "Human oversight",
                        "High-risk AI systems must be designed to allow effective human oversight",
                        true, "Human Oversight",
                        "human_review_capability", "override_mechanisms", "monitoring_dashboards"),
                requirement(ComplianceFramework.EUAIA, "EUAIA-ART-15", "Accuracy, robustness and cybersecurity",
                        "High-risk AI systems must be accurate, robust and secure",
                        true, "Quality and Security",
                        "accuracy_metrics_defined", "robustness_testing", "cybersecurity_measures"),
                requirement(ComplianceFramework.CCPA, "CCPA-1798-100", "Consumer's Right to Know",
                        "Consumers have right to know what personal information is collected",
                        true, "Transparency",
                        "collection_notice_provided", "categories_disclosed", "purposes_disclosed"),
                requirement(ComplianceFramework.CCPA, "CCPA-1798-105", "Right to Delete",
                        "Consumers have right to request deletion of personal information",
                        true, "Data Subject Rights",
                        "deletion_process_implemented", "deletion_request_handling", "verification_procedures"),
                requirement(ComplianceFramework.CCPA, "CCPA-1798-120", "Right to Opt-Out",
                        "Consumers have right to opt-out of sale of personal information",
                        true, "Data Subject Rights",
                        "opt_out_mechanism", "do_not_sell_link", "opt_out_honored"),
                requirement(ComplianceFramework.SOC2, "SOC2-CC6.1", "Logical and Physical Access Controls",
                        "System implements controls to protect against unauthorized access",
                        true, "Security",
                        "access_controls_implemented", "authentication_required", "authorization_enforced"),
                requirement(ComplianceFramework.SOC2, "SOC2-CC7.2", "System Monitoring",
                        "System monitors activities and alerts on anomalies",
                        true, "Monitoring",
                        "monitoring_enabled", "logging_configured", "alerts_configured"),
                requirement(ComplianceFramework.ISO27001, "ISO27001-A.9.1", "Access Control Policy",
                        "Access control policy established and maintained",
                        true, "Access Control",
                        "access_policy_documented", "access_policy_reviewed", "access_controls_enforced"),
                requirement(ComplianceFramework.ISO27001, "ISO27001-A.18.1", "Compliance Requirements",
                        "Compliance with legal, statutory, regulatory and contractual requirements",
                        true, "Compliance",
                        "legal_requirements_identified", "compliance_monitored", "compliance_reported"),
                requirement(ComplianceFramework.PCI_DSS, "PCI-DSS-3.4", "Cardholder Data Protection",
                        "Render cardholder data unreadable anywhere it is stored",
                        true, "Data Protection",
                        "encryption_at_rest", "encryption_in_transit", "key_management"),
                requirement(ComplianceFramework.PCI_DSS, "PCI-DSS-10.1", "Audit Trails",
                        "Implement audit trails to link access to system components",
                        true, "Logging and Monitoring",
                        "audit_logging_enabled", "logs_retained", "logs_reviewed"),
                requirement(ComplianceFramework.COPPA, "COPPA-312.4", "Parental Consent",
                        "Obtain verifiable parental consent before collecting children's data",
                        true, "Consent",
                        "age_verification_implemented", "parental_consent_obtained", "consent_verification"),
                requirement(ComplianceFramework.COPPA, "COPPA-312.5", "Parental Rights",
                        "Provide parents access to children's information and deletion rights",
                        true, "Data Subject Rights",
                        "parent_access_provided", "deletion_mechanism", "data_minimization"));
    }

    private static ComplianceRequirement requirement(ComplianceFramework framework, String id, String title,
                                                     String description, boolean mandatory, String category,
                                                     String... rules) {
        return ComplianceRequirement.builder()
                .framework(framework)
                .requirementId(id)
                .title(title)
                .description(description)
                .mandatory(mandatory)
                .controlCategory(category)
                .validationRules(List.of(rules))
                .build();
    }
}
