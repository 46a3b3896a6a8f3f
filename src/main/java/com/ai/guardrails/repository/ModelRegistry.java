package com.ai.guardrails.repository;

import com.ai.guardrails.model.HealthCheck;
import com.ai.guardrails.model.ModelConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Registered backend models and their current health.
 *
 * Each model's health is a single {@link AtomicReference} to an immutable
 * {@link HealthCheck}; updates replace the whole snapshot so the router never
 * sees a partially applied probe. Registration order is remembered and used
 * as the routing tie-breaker.
 */
@Repository
public class ModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

    public record Entry(ModelConfig config, AtomicReference<HealthCheck> health, int order) {

        public HealthCheck currentHealth() {
            return health.get();
        }
    }

    private final Map<String, Entry> models = new ConcurrentHashMap<>();
    private final AtomicInteger sequence = new AtomicInteger();
    private final Clock clock;

    public ModelRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Register or update a model. Re-registering an id replaces its config but
     * keeps its health state and registration position.
     */
    public void register(ModelConfig config) {
        models.compute(config.getModelId(), (id, existing) -> {
            if (existing != null) {
                log.info("Updated model config: {}", id);
                return new Entry(config, existing.health(), existing.order());
            }
            log.info("Registered model: {} ({}, priority={})", id, config.getProvider(), config.getPriority());
            return new Entry(config, new AtomicReference<>(HealthCheck.initial(id, clock.instant())),
                    sequence.getAndIncrement());
        });
    }

    public Optional<Entry> find(String modelId) {
        return modelId == null ? Optional.empty() : Optional.ofNullable(models.get(modelId));
    }

    public Optional<HealthCheck> findHealth(String modelId) {
        return find(modelId).map(Entry::currentHealth);
    }

    /**
     * All models in registration order.
     */
    public List<Entry> findAll() {
        return models.values().stream()
                .sorted(Comparator.comparingInt(Entry::order))
                .toList();
    }

    /**
     * Atomically replace a model's health snapshot.
     *
     * @return the new snapshot, or empty if the model is not registered
     */
    public Optional<HealthCheck> updateHealth(String modelId, UnaryOperator<HealthCheck> update) {
        return find(modelId).map(entry -> entry.health().updateAndGet(update));
    }

    public int size() {
        return models.size();
    }
}
