package com.ai.guardrails.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Regulatory and security frameworks the compliance audit knows requirements for.
 */
public enum ComplianceFramework implements WireEnum {
    GDPR,
    HIPAA,
    // EU AI Act
    EUAIA,
    CCPA,
    SOC2,
    ISO27001,
    PCI_DSS,
    COPPA;

    @Override
    @JsonValue
    public String getValue() {
        return name();
    }

    @JsonCreator
    public static ComplianceFramework fromValue(String value) {
        return WireEnum.parse(ComplianceFramework.class, "framework", value);
    }
}
