package com.ai.guardrails.client;

import com.ai.guardrails.model.ModelConfig;
import com.ai.guardrails.model.ProbeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Probe used until a provider client is wired in: reports every model as
 * reachable without performing I/O.
 */
@Component
public class PassiveModelProbe implements ModelProbe {

    private static final Logger log = LoggerFactory.getLogger(PassiveModelProbe.class);

    @Override
    public ProbeResult probe(ModelConfig model) {
        log.debug("Passive probe for {} ({})", model.getModelId(), model.getEndpoint());
        return ProbeResult.success(0);
    }
}
