package com.ai.guardrails.model;

public enum Verdict {
    ALLOW,
    REVIEW,
    BLOCK;

    /**
     * Only final outcomes may be served from a decision cache; REVIEW depends
     * on a human step and must be re-evaluated every time.
     */
    public boolean isCacheable() {
        return this != REVIEW;
    }
}
