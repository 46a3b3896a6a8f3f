package com.ai.guardrails.exception;

import com.ai.guardrails.model.ModelCapability;
import lombok.Getter;

/**
 * No registered model is eligible for a routing request. The router never
 * substitutes an ineligible model.
 */
@Getter
public class NoModelAvailableException extends RuntimeException {

    private final ModelCapability capability;
    private final String stage;

    public NoModelAvailableException(ModelCapability capability, String stage, String message) {
        super(message);
        this.capability = capability;
        this.stage = stage;
    }
}
