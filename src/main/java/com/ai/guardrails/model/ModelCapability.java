package com.ai.guardrails.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ModelCapability implements WireEnum {
    TEXT_GENERATION("text_generation"),
    CHAT("chat"),
    CODE_GENERATION("code_generation"),
    EMBEDDINGS("embeddings"),
    IMAGE_GENERATION("image_generation"),
    FUNCTION_CALLING("function_calling");

    private final String value;

    ModelCapability(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ModelCapability fromValue(String value) {
        return WireEnum.parse(ModelCapability.class, "capability", value);
    }
}
