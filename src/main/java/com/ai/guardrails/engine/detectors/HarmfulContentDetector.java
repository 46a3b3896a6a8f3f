package com.ai.guardrails.engine.detectors;

import com.ai.guardrails.engine.SignatureTable;
import com.ai.guardrails.model.ContentDirection;
import com.ai.guardrails.model.RiskCategory;
import com.ai.guardrails.model.RiskLevel;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Requests for, or production of, instructions that enable serious harm.
 */
@Component
public class HarmfulContentDetector extends PatternRiskDetector {

    private static final SignatureTable SIGNATURES = SignatureTable.compile(
            "\\bhow\\s+to\\s+(?:make|build|create)\\s+(?:a\\s+)?(?:bomb|weapon|explosive|poison)",
            "\\b(?:kill|murder|harm|hurt)\\s+(?:someone|people|myself|yourself)\\b",
            "\\bsuicide\\s+(?:method|instruction|guide)",
            "\\bchild\\s+(?:abuse|exploitation)\\b",
            "\\bhuman\\s+trafficking\\b"
    );

    public HarmfulContentDetector() {
        super(RiskCategory.HARMFUL_OUTPUT, Set.of(ContentDirection.PROMPT, ContentDirection.RESPONSE), SIGNATURES,
                RiskLevel.CRITICAL, 95, 0.88,
                "Harmful content detected",
                "Block request and escalate to safety team");
    }
}
