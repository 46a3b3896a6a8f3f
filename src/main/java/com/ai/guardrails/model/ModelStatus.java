package com.ai.guardrails.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ModelStatus implements WireEnum {
    HEALTHY,
    DEGRADED,
    UNAVAILABLE,
    MAINTENANCE;

    public boolean isRoutable() {
        return this == HEALTHY || this == DEGRADED;
    }

    @Override
    @JsonValue
    public String getValue() {
        return name();
    }

    @JsonCreator
    public static ModelStatus fromValue(String value) {
        return WireEnum.parse(ModelStatus.class, "status", value);
    }
}
