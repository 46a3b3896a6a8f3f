package com.ai.guardrails.model;

import com.ai.guardrails.exception.InvalidValueException;

import java.util.Arrays;
import java.util.List;

/**
 * Enum whose external representation is a fixed string. Wire values must stay
 * stable across releases.
 */
public interface WireEnum {

    String getValue();

    static <E extends Enum<E> & WireEnum> E parse(Class<E> type, String field, String raw) {
        E[] constants = type.getEnumConstants();
        if (raw != null) {
            String trimmed = raw.trim();
            for (E constant : constants) {
                if (constant.getValue().equalsIgnoreCase(trimmed)) {
                    return constant;
                }
            }
        }
        List<String> valid = Arrays.stream(constants).map(WireEnum::getValue).toList();
        throw new InvalidValueException(field, raw, valid);
    }
}
