package com.ai.guardrails.engine.detectors;

import com.ai.guardrails.engine.SignatureTable;
import com.ai.guardrails.model.ContentDirection;
import com.ai.guardrails.model.RiskCategory;
import com.ai.guardrails.model.RiskLevel;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Attempts to talk the model out of its instructions or safety rules.
 * Prompt side only.
 */
@Component
public class JailbreakDetector extends PatternRiskDetector {

    private static final SignatureTable SIGNATURES = SignatureTable.compile(
            "\\bignore\\s+(?:all\\s+|any\\s+)?(?:(?:your|the)\\s+)?(?:previous\\s+|prior\\s+|above\\s+|earlier\\s+)?(?:instructions|rules|guidelines|directives)\\b",
            "\\byou\\s+(?:are|must\\s+be)\\s+now\\s+(?:in\\s+)?(?:a\\s+)?(?:DAN|developer|jailbreak|unrestricted)\\s+mode\\b",
            "\\b(?:pretend|act|behave)\\s+(?:as\\s+if|like)\\s+you\\s+(?:have\\s+no|don'?t\\s+have(?:\\s+any)?)\\s+(?:restrictions|limitations|rules)\\b",
            "\\bdisregard\\s+(?:your|all)\\s+(?:programming|training|guidelines|safety)\\b",
            "\\bfrom\\s+now\\s+on\\b.*\\brespond\\s+(?:only|directly)\\s+(?:to|with)\\b",
            "\\byou\\s+will\\s+now\\s+(?:forget|ignore)\\s+(?:your|all)\\s+(?:constraints|limitations)\\b"
    );

    public JailbreakDetector() {
        super(RiskCategory.JAILBREAK_ATTEMPT, Set.of(ContentDirection.PROMPT), SIGNATURES,
                RiskLevel.HIGH, 85, 0.90,
                "Jailbreak pattern detected",
                "Reject prompt and log security incident");
    }
}
