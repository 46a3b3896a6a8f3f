package com.ai.guardrails.service;

import com.ai.guardrails.config.MetricsConfig;
import com.ai.guardrails.config.RoutingProperties;
import com.ai.guardrails.exception.InvalidValueException;
import com.ai.guardrails.exception.NoModelAvailableException;
import com.ai.guardrails.model.HealthCheck;
import com.ai.guardrails.model.ModelCapability;
import com.ai.guardrails.model.ModelConfig;
import com.ai.guardrails.model.ModelStatus;
import com.ai.guardrails.model.RoutingDecision;
import com.ai.guardrails.model.RoutingRequest;
import com.ai.guardrails.repository.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Picks a backend model for a capability.
 *
 * Candidates must support the capability, be enabled and be HEALTHY or
 * DEGRADED. Each is scored as
 * <pre>
 *   30 × priority/100
 * + (40 HEALTHY | 20 DEGRADED) + 10 × successRate
 * + W × max(0, 1 − latency/latencyThreshold)     W = 40 for low latency, else 20
 * + 10 × max(0, 1 − cost/costReferenceCeiling)
 * </pre>
 * Highest score wins; registration order breaks ties. The router reads a
 * health snapshot per model and never writes health state.
 */
@Service
public class ModelRouter {

    private static final Logger log = LoggerFactory.getLogger(ModelRouter.class);

    private record Candidate(ModelRegistry.Entry entry, HealthCheck health, double score) {

        ModelConfig config() {
            return entry.config();
        }
    }

    private final ModelRegistry modelRegistry;
    private final RoutingProperties properties;
    private final MetricsConfig metricsConfig;

    public ModelRouter(ModelRegistry modelRegistry, RoutingProperties properties, MetricsConfig metricsConfig) {
        this.modelRegistry = modelRegistry;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Route by capability wire value, e.g. {@code "chat"}.
     *
     * @throws InvalidValueException if the capability is not a known value
     */
    public RoutingDecision route(String capability, String preference, Double maxCost, boolean lowLatency) {
        return route(RoutingRequest.builder()
                .capability(ModelCapability.fromValue(capability))
                .preference(preference)
                .maxCost(maxCost)
                .lowLatency(lowLatency)
                .build());
    }

    public RoutingDecision route(RoutingRequest request) {
        ModelCapability capability = request.getCapability();
        if (capability == null) {
            throw new InvalidValueException("capability", "Capability is required");
        }

        // Snapshot each model's health once so filtering and scoring agree
        List<Candidate> eligible = new ArrayList<>();
        for (ModelRegistry.Entry entry : modelRegistry.findAll()) {
            HealthCheck health = entry.currentHealth();
            ModelConfig config = entry.config();
            if (config.supports(capability) && config.isEnabled() && health.getStatus().isRoutable()) {
                eligible.add(new Candidate(entry, health, 0));
            }
        }
        if (eligible.isEmpty()) {
            throw noModel(capability, "capability",
                    "No model available for capability: " + capability.getValue());
        }

        if (request.getMaxCost() != null) {
            double maxCost = request.getMaxCost();
            eligible.removeIf(c -> c.config().getCostPerUnit() > maxCost);
            if (eligible.isEmpty()) {
                throw noModel(capability, "max_cost",
                        "No model for capability " + capability.getValue() + " within max cost " + maxCost);
            }
        }

        boolean preferenceMatched = false;
        String preference = request.getPreference();
        if (preference != null && !preference.isBlank()) {
            List<Candidate> preferred = eligible.stream()
                    .filter(c -> matchesPreference(c.config(), preference.trim()))
                    .toList();
            if (!preferred.isEmpty()) {
                eligible = new ArrayList<>(preferred);
                preferenceMatched = true;
            }
        }

        List<Candidate> ranked = new ArrayList<>();
        for (Candidate c : eligible) {
            ranked.add(new Candidate(c.entry(), c.health(), score(c.config(), c.health(), request.isLowLatency())));
        }
        ranked.sort(Comparator.comparingDouble(Candidate::score).reversed()
                .thenComparingInt(c -> c.entry().order()));

        Candidate primary = ranked.get(0);
        List<String> failover = ranked.stream()
                .skip(1)
                .limit(properties.getFailoverSize())
                .map(c -> c.config().getModelId())
                .toList();

        long latency = primary.health().getLatencyMs();
        RoutingDecision decision = RoutingDecision.builder()
                .selectedModel(primary.config().getModelId())
                .provider(primary.config().getProvider())
                .reason(reason(primary, request, preferenceMatched ? preference.trim() : null))
                .failoverModels(failover)
                .estimatedLatencyMs(latency > 0 ? latency : properties.getDefaultEstimatedLatencyMs())
                .estimatedCost(primary.config().getCostPerUnit())
                .score(primary.score())
                .build();

        metricsConfig.recordRoutingDecision(decision.getSelectedModel());
        log.debug("Routed {} to {} (score={}, failover={})",
                capability.getValue(), decision.getSelectedModel(), primary.score(), failover);
        return decision;
    }

    double score(ModelConfig config, HealthCheck health, boolean lowLatency) {
        double score = 30.0 * config.getPriority() / 100.0;

        if (health.getStatus() == ModelStatus.HEALTHY) {
            score += 40;
        } else if (health.getStatus() == ModelStatus.DEGRADED) {
            score += 20;
        }
        score += health.getSuccessRate() * 10;

        double latencyWeight = lowLatency ? 40 : 20;
        if (config.getLatencyThresholdMs() > 0) {
            score += latencyWeight * Math.max(0, 1.0 - (double) health.getLatencyMs() / config.getLatencyThresholdMs());
        }

        score += 10 * Math.max(0, 1.0 - config.getCostPerUnit() / properties.getCostReferenceCeiling());
        return score;
    }

    private static boolean matchesPreference(ModelConfig config, String preference) {
        return config.getModelId().equalsIgnoreCase(preference)
                || (config.getProvider() != null && config.getProvider().getValue().equalsIgnoreCase(preference));
    }

    private String reason(Candidate primary, RoutingRequest request, String matchedPreference) {
        List<String> reasons = new ArrayList<>();
        ModelConfig config = primary.config();
        HealthCheck health = primary.health();

        if (matchedPreference != null) {
            reasons.add("User preference: " + matchedPreference);
        }
        if (health.getStatus() == ModelStatus.HEALTHY) {
            reasons.add("Healthy status");
        }
        if (request.isLowLatency() && health.getLatencyMs() < config.getLatencyThresholdMs()) {
            reasons.add("Low latency (" + health.getLatencyMs() + "ms)");
        }
        if (config.getPriority() >= properties.getHighPriorityFrom()) {
            reasons.add("High priority model");
        }
        if (config.getCostPerUnit() < properties.getCostEfficientBelow()) {
            reasons.add("Cost-efficient");
        }
        return reasons.isEmpty() ? "Best available match" : String.join("; ", reasons);
    }

    private NoModelAvailableException noModel(ModelCapability capability, String stage, String message) {
        metricsConfig.recordNoModelAvailable(capability.getValue());
        log.warn(message);
        return new NoModelAvailableException(capability, stage, message);
    }
}
