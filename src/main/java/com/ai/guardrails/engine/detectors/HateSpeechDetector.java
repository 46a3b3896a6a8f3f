package com.ai.guardrails.engine.detectors;

import com.ai.guardrails.engine.SignatureTable;
import com.ai.guardrails.model.ToxicityCategory;
import org.springframework.stereotype.Component;

/**
 * Slurs and calls for violence against groups. Always scores 1.0.
 */
@Component
public class HateSpeechDetector extends PatternToxicityDetector {

    private static final SignatureTable SIGNATURES = SignatureTable.compile(
            "\\b(?:n[i1]gg[ae]r|n[i1]gg[ae]|n[1i]gg[0o]|k[i1]ke|ch[i1]nk|sp[i1]c|beaner|wetback)\\b",
            "(?:death\\s+to|kill\\s+all|exterminate|genocide).{0,20}(?:jews|muslims|christians|blacks|whites|gays)",
            "(?:sub-human|inferior\\s+race|master\\s+race)"
    );

    public HateSpeechDetector() {
        super(ToxicityCategory.HATE_SPEECH, SIGNATURES, 1.0);
    }
}
