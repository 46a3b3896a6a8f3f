package com.ai.guardrails.exception;

import lombok.Getter;

import java.util.List;

/**
 * Raised when an input field carries a value outside its closed set
 * (unknown capability, unknown enum wire value) or is otherwise unusable.
 * No partial result is ever returned alongside it.
 */
@Getter
public class InvalidValueException extends RuntimeException {

    private final String field;
    private final String rejectedValue;
    private final List<String> validValues;

    public InvalidValueException(String field, String rejectedValue, List<String> validValues) {
        super(String.format("Invalid %s: '%s'. Must be one of: %s",
                field, rejectedValue, String.join(", ", validValues)));
        this.field = field;
        this.rejectedValue = rejectedValue;
        this.validValues = List.copyOf(validValues);
    }

    public InvalidValueException(String field, String message) {
        super(String.format("Invalid %s: %s", field, message));
        this.field = field;
        this.rejectedValue = null;
        this.validValues = List.of();
    }
}
