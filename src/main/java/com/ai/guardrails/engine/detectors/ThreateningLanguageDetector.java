package com.ai.guardrails.engine.detectors;

import com.ai.guardrails.engine.SignatureTable;
import com.ai.guardrails.model.ToxicityCategory;
import org.springframework.stereotype.Component;

/**
 * First-person statements of intent to harm, and intimidation phrases.
 */
@Component
public class ThreateningLanguageDetector extends PatternToxicityDetector {

    private static final SignatureTable SIGNATURES = SignatureTable.compile(
            "\\b(?:i\\s+will|i'll|gonna|going\\s+to).{0,30}\\b(?:kill|hurt|harm|destroy|attack|bomb|shoot)\\b",
            "\\b(?:watch\\s+your\\s+back|you're\\s+dead|you\\s+better\\s+watch\\s+out)",
            "\\b(?:threat|threaten|threatening).{0,20}\\b(?:you|your|violence)\\b"
    );

    public ThreateningLanguageDetector() {
        super(ToxicityCategory.THREAT, SIGNATURES, 0.95);
    }
}
