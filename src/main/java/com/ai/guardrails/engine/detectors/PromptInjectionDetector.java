package com.ai.guardrails.engine.detectors;

import com.ai.guardrails.engine.SignatureTable;
import com.ai.guardrails.model.ContentDirection;
import com.ai.guardrails.model.RiskCategory;
import com.ai.guardrails.model.RiskLevel;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Role markers, chat-template tokens and requests to expose hidden
 * instructions. Prompt side only.
 */
@Component
public class PromptInjectionDetector extends PatternRiskDetector {

    private static final SignatureTable SIGNATURES = SignatureTable.compile(
            "\\b(?:system|assistant|user):\\s*\\n",
            "###?\\s*(?:instruction|system|prompt)s?\\s*:",
            "<\\|?(?:system|im_start|endoftext|user)\\|?>",
            "\\bignore\\s+the\\s+(?:above|previous)\\s+and\\s+(?:instead|now)\\b",
            "\\b(?:reveal|show|print|output|repeat)\\s+(?:me\\s+)?(?:your|the)\\s+(?:system|hidden|initial)\\s+(?:prompt|instructions)\\b"
    );

    public PromptInjectionDetector() {
        super(RiskCategory.PROMPT_INJECTION, Set.of(ContentDirection.PROMPT), SIGNATURES,
                RiskLevel.HIGH, 80, 0.85,
                "Injection pattern detected",
                "Sanitize input and use structured prompts");
    }
}
