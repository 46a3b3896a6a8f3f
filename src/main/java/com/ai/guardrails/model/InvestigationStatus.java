package com.ai.guardrails.model;

/**
 * Incident lifecycle. The core only ever creates incidents as NEW; later
 * transitions belong to case management.
 */
public enum InvestigationStatus {
    NEW,
    INVESTIGATING,
    RESOLVED,
    FALSE_POSITIVE
}
