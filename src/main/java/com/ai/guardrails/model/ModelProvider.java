package com.ai.guardrails.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ModelProvider implements WireEnum {
    OPENAI("openai"),
    ANTHROPIC("anthropic"),
    GOOGLE("google"),
    AZURE("azure"),
    AWS_BEDROCK("aws_bedrock"),
    COHERE("cohere"),
    HUGGINGFACE("huggingface"),
    LOCAL("local");

    private final String value;

    ModelProvider(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ModelProvider fromValue(String value) {
        return WireEnum.parse(ModelProvider.class, "provider", value);
    }
}
