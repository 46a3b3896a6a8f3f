package com.ai.guardrails.client;

import com.ai.guardrails.model.ModelConfig;
import com.ai.guardrails.model.ProbeResult;

/**
 * Liveness probe against a backend model endpoint.
 *
 * Implementations may block and may throw; the health service applies the
 * per-probe timeout and turns exceptions into failed probes.
 */
@FunctionalInterface
public interface ModelProbe {

    ProbeResult probe(ModelConfig model) throws Exception;
}
