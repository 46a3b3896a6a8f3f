package com.ai.guardrails.engine.detectors;

import com.ai.guardrails.engine.SignatureTable;
import com.ai.guardrails.model.ToxicityCategory;
import org.springframework.stereotype.Component;

@Component
public class HarassmentDetector extends PatternToxicityDetector {

    private static final SignatureTable SIGNATURES = SignatureTable.compile(
            "\\byou\\s+(?:are|should)\\b.{0,30}(?:die|kill\\s+yourself|end\\s+your\\s+life)",
            "\\b(?:stupid|idiot|moron|retard|dumb).{0,20}(?:person|people|user)",
            "\\b(?:fat|ugly|disgusting|worthless|pathetic).{0,20}(?:person|piece\\s+of)"
    );

    public HarassmentDetector() {
        super(ToxicityCategory.HARASSMENT, SIGNATURES, 0.75);
    }
}
