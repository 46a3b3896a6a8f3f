package com.ai.guardrails.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskCategory implements WireEnum {
    DATA_LEAKAGE,
    HARMFUL_OUTPUT,
    ADVERSARIAL_ATTACK,
    COMPLIANCE_VIOLATION,
    BIAS_DISCRIMINATION,
    MISINFORMATION,
    PROMPT_INJECTION,
    JAILBREAK_ATTEMPT;

    @Override
    @JsonValue
    public String getValue() {
        return name();
    }

    @JsonCreator
    public static RiskCategory fromValue(String value) {
        return WireEnum.parse(RiskCategory.class, "risk_category", value);
    }
}
