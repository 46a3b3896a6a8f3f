package com.ai.guardrails.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ToxicityCategory implements WireEnum {
    PROFANITY,
    HATE_SPEECH,
    SEXUAL_CONTENT,
    VIOLENCE,
    HARASSMENT,
    THREAT,
    IDENTITY_ATTACK,
    // Reserved wire value; no pattern detector emits it yet.
    INSULT;

    @Override
    @JsonValue
    public String getValue() {
        return name();
    }

    @JsonCreator
    public static ToxicityCategory fromValue(String value) {
        return WireEnum.parse(ToxicityCategory.class, "toxicity_category", value);
    }
}
