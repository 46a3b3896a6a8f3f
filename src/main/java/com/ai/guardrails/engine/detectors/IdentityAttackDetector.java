package com.ai.guardrails.engine.detectors;

import com.ai.guardrails.engine.SignatureTable;
import com.ai.guardrails.model.ToxicityCategory;
import org.springframework.stereotype.Component;

@Component
public class IdentityAttackDetector extends PatternToxicityDetector {

    private static final SignatureTable SIGNATURES = SignatureTable.compile(
            "\\ball\\s+(?:women|men|blacks|whites|asians|hispanics|jews|muslims|christians|gays|trans)\\b.{0,30}\\b(?:are|should)\\b",
            "\\b(?:typical|stereotypical).{0,20}\\b(?:woman|man|black|white|asian|jew|muslim|gay)\\b"
    );

    public IdentityAttackDetector() {
        super(ToxicityCategory.IDENTITY_ATTACK, SIGNATURES, 0.8);
    }
}
