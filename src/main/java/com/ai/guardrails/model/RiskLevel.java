package com.ai.guardrails.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskLevel implements WireEnum {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    MINIMAL;

    public static RiskLevel fromScore(int score) {
        if (score >= 85) return CRITICAL;
        if (score >= 70) return HIGH;
        if (score >= 50) return MEDIUM;
        if (score >= 30) return LOW;
        return MINIMAL;
    }

    @Override
    @JsonValue
    public String getValue() {
        return name();
    }

    @JsonCreator
    public static RiskLevel fromValue(String value) {
        return WireEnum.parse(RiskLevel.class, "risk_level", value);
    }
}
