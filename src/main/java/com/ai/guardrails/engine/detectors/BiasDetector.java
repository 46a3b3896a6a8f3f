package com.ai.guardrails.engine.detectors;

import com.ai.guardrails.engine.SignatureTable;
import com.ai.guardrails.model.ContentDirection;
import com.ai.guardrails.model.RiskCategory;
import com.ai.guardrails.model.RiskLevel;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Sweeping generalizations about protected groups in model output.
 */
@Component
public class BiasDetector extends PatternRiskDetector {

    private static final SignatureTable SIGNATURES = SignatureTable.compile(
            "\\ball\\s+(?:women|men|blacks|whites|asians|muslims|christians|jews)\\s+are\\b",
            "\\b(?:women|men)\\s+(?:can'?t|cannot|shouldn'?t)\\s+(?:be|do)\\b",
            "\\b(?:inferior|superior)\\s+(?:race|gender|religion)\\b"
    );

    public BiasDetector() {
        super(RiskCategory.BIAS_DISCRIMINATION, Set.of(ContentDirection.RESPONSE), SIGNATURES,
                RiskLevel.HIGH, 75, 0.75,
                "Potential bias detected",
                "Review and revise response for fairness");
    }
}
