package com.ai.guardrails.engine;

import com.ai.guardrails.model.ContentDirection;
import com.ai.guardrails.model.RiskCategory;
import com.ai.guardrails.model.RiskFactor;

import java.util.Set;

/**
 * Detector feeding the risk assessment. Each firing yields exactly one
 * {@link RiskFactor}.
 */
public interface RiskDetector extends SignalDetector<RiskCategory, RiskFactor> {

    /**
     * Which sides of a model call this detector is applied to.
     */
    Set<ContentDirection> getDirections();
}
