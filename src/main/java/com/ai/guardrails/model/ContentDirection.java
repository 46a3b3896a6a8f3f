package com.ai.guardrails.model;

/**
 * Which side of a model call the content comes from.
 */
public enum ContentDirection {
    PROMPT,
    RESPONSE
}
