package com.ai.guardrails.engine.detectors;

import com.ai.guardrails.engine.SignatureTable;
import com.ai.guardrails.model.ToxicityCategory;
import org.springframework.stereotype.Component;

@Component
public class SexualContentDetector extends PatternToxicityDetector {

    private static final SignatureTable SIGNATURES = SignatureTable.compile(
            "\\b(?:porn|pornography|xxx|sex|nude|naked|erotic)\\b",
            "\\b(?:sexual|sexually).{0,20}(?:explicit|graphic|aroused|stimulated)",
            "\\b(?:breast|penis|vagina|genitals|anal|oral).{0,30}(?:explicit|graphic|detailed)"
    );

    public SexualContentDetector() {
        super(ToxicityCategory.SEXUAL_CONTENT, SIGNATURES, 0.6);
    }
}
