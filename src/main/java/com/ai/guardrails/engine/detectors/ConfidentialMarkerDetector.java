package com.ai.guardrails.engine.detectors;

import com.ai.guardrails.engine.RiskDetector;
import com.ai.guardrails.engine.SignatureTable;
import com.ai.guardrails.model.ContentDirection;
import com.ai.guardrails.model.RiskCategory;
import com.ai.guardrails.model.RiskFactor;
import com.ai.guardrails.model.RiskLevel;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Document classification markers suggesting the text should not leave the
 * organisation. Counts distinct markers present.
 */
@Component
public class ConfidentialMarkerDetector implements RiskDetector {

    private static final SignatureTable MARKERS = SignatureTable.compile(
            "\\bCONFIDENTIAL\\b",
            "\\bINTERNAL\\s+ONLY\\b",
            "\\bPROPRIETARY\\b",
            "\\bTRADE\\s+SECRET\\b",
            "@confidential",
            "@proprietary"
    );

    @Override
    public RiskCategory getCategory() {
        return RiskCategory.COMPLIANCE_VIOLATION;
    }

    @Override
    public Set<ContentDirection> getDirections() {
        return Set.of(ContentDirection.PROMPT, ContentDirection.RESPONSE);
    }

    @Override
    public Optional<RiskFactor> detect(String content) {
        int markers = MARKERS.matchingSignatures(content).size();
        if (markers == 0) {
            return Optional.empty();
        }
        return Optional.of(RiskFactor.builder()
                .category(RiskCategory.COMPLIANCE_VIOLATION)
                .severity(RiskLevel.CRITICAL)
                .score(90)
                .confidence(0.98)
                .evidence(List.of("Confidential markers detected: " + markers))
                .mitigation("Block response and audit data access")
                .build());
    }
}
