package com.ai.guardrails.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ThreatCategory implements WireEnum {
    PROMPT_INJECTION,
    JAILBREAK,
    DATA_EXFILTRATION,
    MODEL_MANIPULATION,
    ADVERSARIAL_INPUT,
    SOCIAL_ENGINEERING,
    API_ABUSE,
    UNAUTHORIZED_ACCESS,
    POISONING_ATTACK;

    @Override
    @JsonValue
    public String getValue() {
        return name();
    }

    @JsonCreator
    public static ThreatCategory fromValue(String value) {
        return WireEnum.parse(ThreatCategory.class, "threat_category", value);
    }
}
