package com.ai.guardrails.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ComplianceStatus implements WireEnum {
    COMPLIANT,
    PARTIAL,
    NON_COMPLIANT;

    @Override
    @JsonValue
    public String getValue() {
        return name();
    }

    @JsonCreator
    public static ComplianceStatus fromValue(String value) {
        return WireEnum.parse(ComplianceStatus.class, "compliance_status", value);
    }
}
