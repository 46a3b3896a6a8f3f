package com.ai.guardrails.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ThreatLevel implements WireEnum {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    INFO;

    /**
     * Threat levels that force a BLOCK verdict on their own.
     */
    public boolean isBlocking() {
        return this == CRITICAL || this == HIGH;
    }

    @Override
    @JsonValue
    public String getValue() {
        return name();
    }

    @JsonCreator
    public static ThreatLevel fromValue(String value) {
        return WireEnum.parse(ThreatLevel.class, "threat_level", value);
    }
}
