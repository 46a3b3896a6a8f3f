package com.ai.guardrails.model;

import lombok.Value;

@Value
public class ProbeResult {

    boolean success;
    long latencyMs;
    String error;

    public static ProbeResult success(long latencyMs) {
        return new ProbeResult(true, latencyMs, null);
    }

    public static ProbeResult failure(String error) {
        return new ProbeResult(false, 0, error);
    }
}
