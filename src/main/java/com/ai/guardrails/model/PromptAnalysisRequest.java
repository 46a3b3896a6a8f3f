package com.ai.guardrails.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromptAnalysisRequest {

    private String prompt;

    // Caller identity; incidents are only recorded when present
    private String subject;

    private String modelId;

    private boolean strictMode;

    @Builder.Default
    private Map<String, Object> context = new HashMap<>();
}
