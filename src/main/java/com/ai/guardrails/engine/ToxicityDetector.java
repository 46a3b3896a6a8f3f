package com.ai.guardrails.engine;

import com.ai.guardrails.model.ToxicityCategory;
import com.ai.guardrails.model.ToxicityFinding;

/**
 * Detector feeding content moderation. Scores are in [0, 1].
 */
public interface ToxicityDetector extends SignalDetector<ToxicityCategory, ToxicityFinding> {
}
