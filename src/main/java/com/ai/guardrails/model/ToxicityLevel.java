package com.ai.guardrails.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ToxicityLevel implements WireEnum {
    SEVERE,
    HIGH,
    MODERATE,
    LOW,
    CLEAN;

    public static ToxicityLevel fromScore(double score) {
        if (score >= 0.9) return SEVERE;
        if (score >= 0.7) return HIGH;
        if (score >= 0.5) return MODERATE;
        if (score >= 0.3) return LOW;
        return CLEAN;
    }

    @Override
    @JsonValue
    public String getValue() {
        return name();
    }

    @JsonCreator
    public static ToxicityLevel fromValue(String value) {
        return WireEnum.parse(ToxicityLevel.class, "toxicity_level", value);
    }
}
