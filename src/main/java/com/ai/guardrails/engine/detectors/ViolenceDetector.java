package com.ai.guardrails.engine.detectors;

import com.ai.guardrails.engine.SignatureTable;
import com.ai.guardrails.model.ToxicityCategory;
import org.springframework.stereotype.Component;

@Component
public class ViolenceDetector extends PatternToxicityDetector {

    private static final SignatureTable SIGNATURES = SignatureTable.compile(
            "\\b(?:kill|murder|assassinate|execute|slaughter|massacre).{0,30}\\b(?:him|her|them|people)\\b",
            "\\b(?:torture|mutilate|dismember|maim|disfigure)",
            "\\b(?:blood|gore|brutal|savage|violent).{0,20}(?:attack|assault|beating)"
    );

    public ViolenceDetector() {
        super(ToxicityCategory.VIOLENCE, SIGNATURES, 0.8);
    }
}
