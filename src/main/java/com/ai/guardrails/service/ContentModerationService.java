package com.ai.guardrails.service;

import com.ai.guardrails.config.GuardrailProperties;
import com.ai.guardrails.engine.DetectorEngine;
import com.ai.guardrails.engine.Redactor;
import com.ai.guardrails.model.ModerationResult;
import com.ai.guardrails.model.ToxicityCategory;
import com.ai.guardrails.model.ToxicityFinding;
import com.ai.guardrails.model.ToxicityLevel;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Fuses toxicity findings into a moderation verdict.
 *
 * The overall score is the maximum category score: one severe category is not
 * diluted by clean ones. Blocking requires the score to reach the active
 * threshold and the level to be SEVERE or HIGH; only then is redacted text
 * produced.
 */
@Service
public class ContentModerationService {

    private final DetectorEngine detectorEngine;
    private final GuardrailProperties properties;

    public ContentModerationService(DetectorEngine detectorEngine, GuardrailProperties properties) {
        this.detectorEngine = detectorEngine;
        this.properties = properties;
    }

    public ModerationResult moderate(String content) {
        return moderate(content, false);
    }

    public ModerationResult moderate(String content, boolean strictMode) {
        List<ToxicityFinding> findings = detectorEngine.detectToxicity(content);

        double score = 0.0;
        Set<ToxicityCategory> categories = EnumSet.noneOf(ToxicityCategory.class);
        Set<String> flagged = new LinkedHashSet<>();
        for (ToxicityFinding finding : findings) {
            score = Math.max(score, finding.getScore());
            categories.add(finding.getCategory());
            flagged.addAll(finding.getMatches());
        }

        ToxicityLevel level = ToxicityLevel.fromScore(score);
        double threshold = strictMode ? properties.getStrictToxicityThreshold() : properties.getToxicityThreshold();
        boolean toxic = !findings.isEmpty() && score >= threshold;
        boolean shouldBlock = toxic && (level == ToxicityLevel.SEVERE || level == ToxicityLevel.HIGH);

        return ModerationResult.builder()
                .toxic(toxic)
                .toxicityScore(score)
                .toxicityLevel(level)
                .categories(categories)
                .flaggedContent(List.copyOf(flagged))
                .shouldBlock(shouldBlock)
                .redactedContent(shouldBlock ? Redactor.redact(content, flagged) : null)
                .build();
    }
}
