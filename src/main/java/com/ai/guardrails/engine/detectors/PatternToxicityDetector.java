package com.ai.guardrails.engine.detectors;

import com.ai.guardrails.engine.SignatureTable;
import com.ai.guardrails.engine.ToxicityDetector;
import com.ai.guardrails.model.ToxicityCategory;
import com.ai.guardrails.model.ToxicityFinding;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Base for toxicity detectors with a fixed category score. Any signature hit
 * yields the full score; the finding lists every distinct matched substring.
 */
abstract class PatternToxicityDetector implements ToxicityDetector {

    private final ToxicityCategory category;
    private final SignatureTable signatures;
    private final double score;

    protected PatternToxicityDetector(ToxicityCategory category, SignatureTable signatures, double score) {
        this.category = category;
        this.signatures = signatures;
        this.score = score;
    }

    @Override
    public ToxicityCategory getCategory() {
        return category;
    }

    @Override
    public Optional<ToxicityFinding> detect(String content) {
        List<String> matches = signatures.allMatches(content);
        if (matches.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(ToxicityFinding.builder()
                .category(category)
                .score(score)
                .matches(List.copyOf(new LinkedHashSet<>(matches)))
                .build());
    }
}
