package com.ai.guardrails.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoutingRequest {

    private ModelCapability capability;

    // Model id or provider wire value
    private String preference;

    // Null means no cost ceiling
    private Double maxCost;

    private boolean lowLatency;
}
