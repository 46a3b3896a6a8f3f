package com.ai.guardrails.service;

import com.ai.guardrails.client.ModelProbe;
import com.ai.guardrails.config.MetricsConfig;
import com.ai.guardrails.config.RoutingProperties;
import com.ai.guardrails.exception.InvalidValueException;
import com.ai.guardrails.model.HealthCheck;
import com.ai.guardrails.model.ModelConfig;
import com.ai.guardrails.model.ModelStats;
import com.ai.guardrails.model.ModelStatus;
import com.ai.guardrails.model.ProbeResult;
import com.ai.guardrails.repository.ModelRegistry;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Probes registered models and drives their health state.
 *
 * State per model:
 * - success: HEALTHY, failures reset to 0
 * - failure: DEGRADED, or UNAVAILABLE once the configured number of
 *   consecutive failures is reached
 * - UNAVAILABLE models are re-probed only after an exponential backoff;
 *   that probe is the half-open trial
 * - MAINTENANCE is set by an operator and never changed by a probe
 *
 * At most one probe per model is in flight. Bulk checks fan out on the probe
 * executor, each probe with its own timeout measured from the moment it starts
 * running, and return only after every probe has resolved. A model whose
 * worker is still stuck past its timeout gets a failure per sweep instead of
 * a second worker.
 */
@Service
public class ModelHealthService {

    private static final Logger log = LoggerFactory.getLogger(ModelHealthService.class);

    private final ModelRegistry modelRegistry;
    private final ModelProbe modelProbe;
    private final Executor probeExecutor;
    private final RoutingProperties routingProperties;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final Set<String> overdue = ConcurrentHashMap.newKeySet();

    public ModelHealthService(ModelRegistry modelRegistry,
                              ModelProbe modelProbe,
                              @Qualifier("probeExecutor") Executor probeExecutor,
                              RoutingProperties routingProperties,
                              MetricsConfig metricsConfig,
                              Clock clock) {
        this.modelRegistry = modelRegistry;
        this.modelProbe = modelProbe;
        this.probeExecutor = probeExecutor;
        this.routingProperties = routingProperties;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Probe every registered model concurrently and wait for all of them.
     *
     * @return health snapshots after the sweep, in registration order
     */
    @Observed(name = "model.health_check_all", contextualName = "health-check-all")
    public List<HealthCheck> checkAll() {
        List<ModelRegistry.Entry> entries = modelRegistry.findAll();
        List<CompletableFuture<Void>> probes = new ArrayList<>(entries.size());
        for (ModelRegistry.Entry entry : entries) {
            probes.add(probe(entry));
        }
        CompletableFuture.allOf(probes.toArray(new CompletableFuture[0])).join();

        List<HealthCheck> health = getModelHealth();
        int unavailable = updateUnavailableGauge(health);
        log.info("Health check complete: models={}, unavailable={}", health.size(), unavailable);
        return health;
    }

    /**
     * Probe a single model and wait for the outcome.
     */
    public HealthCheck checkModel(String modelId) {
        ModelRegistry.Entry entry = requireModel(modelId);
        probe(entry).join();
        updateUnavailableGauge(getModelHealth());
        return entry.currentHealth();
    }

    /**
     * Operator override, typically to move a model in or out of MAINTENANCE.
     * Setting HEALTHY clears the failure count and any pending backoff.
     */
    public HealthCheck updateModelStatus(String modelId, ModelStatus status) {
        requireModel(modelId);
        Instant now = clock.instant();
        HealthCheck updated = modelRegistry.updateHealth(modelId, current -> {
            HealthCheck.HealthCheckBuilder next = current.toBuilder().status(status).lastCheck(now);
            if (status == ModelStatus.HEALTHY) {
                next.consecutiveFailures(0).nextProbeAt(null);
            }
            return next.build();
        }).orElseThrow();
        log.info("Model {} status set to {}", modelId, status);
        updateUnavailableGauge(getModelHealth());
        return updated;
    }

    public HealthCheck updateModelStatus(String modelId, String status) {
        return updateModelStatus(modelId, ModelStatus.fromValue(status));
    }

    public List<HealthCheck> getModelHealth() {
        return modelRegistry.findAll().stream().map(ModelRegistry.Entry::currentHealth).toList();
    }

    public List<ModelStats> getModelStats() {
        List<ModelStats> stats = new ArrayList<>();
        for (ModelRegistry.Entry entry : modelRegistry.findAll()) {
            ModelConfig config = entry.config();
            HealthCheck health = entry.currentHealth();
            stats.add(ModelStats.builder()
                    .modelId(config.getModelId())
                    .provider(config.getProvider())
                    .status(health.getStatus())
                    .enabled(config.isEnabled())
                    .priority(config.getPriority())
                    .latencyMs(health.getLatencyMs())
                    .successRate(health.getSuccessRate())
                    .consecutiveFailures(health.getConsecutiveFailures())
                    .lastCheck(health.getLastCheck())
                    .capabilities(config.getCapabilities())
                    .costPerUnit(config.getCostPerUnit())
                    .build());
        }
        return stats;
    }

    private CompletableFuture<Void> probe(ModelRegistry.Entry entry) {
        ModelConfig config = entry.config();
        String modelId = config.getModelId();
        HealthCheck current = entry.currentHealth();
        Instant now = clock.instant();

        if (current.getStatus() == ModelStatus.MAINTENANCE) {
            metricsConfig.recordProbe(modelId, "skipped");
            return CompletableFuture.completedFuture(null);
        }
        if (current.getStatus() == ModelStatus.UNAVAILABLE
                && current.getNextProbeAt() != null && now.isBefore(current.getNextProbeAt())) {
            log.debug("Model {} in recovery backoff until {}", modelId, current.getNextProbeAt());
            metricsConfig.recordProbe(modelId, "skipped");
            return CompletableFuture.completedFuture(null);
        }
        if (!inFlight.add(modelId)) {
            if (overdue.contains(modelId)) {
                // Worker still stuck in a probe that already timed out
                applyOutcome(modelId, ProbeResult.failure("Previous probe still running past its timeout"));
            } else {
                log.debug("Probe already in flight for {}", modelId);
            }
            return CompletableFuture.completedFuture(null);
        }

        long timeoutMs = routingProperties.getHealth().getProbeTimeoutMs();
        ProbeRun run = new ProbeRun(config, timeoutMs);
        CompletableFuture<Void> applied = run.outcome.handle((result, error) -> {
            if (error != null) {
                run.interruptWorker();
            }
            ProbeResult outcome = error == null ? result : ProbeResult.failure(describe(error, timeoutMs));
            applyOutcome(modelId, outcome);
            return null;
        });
        try {
            probeExecutor.execute(run);
        } catch (RuntimeException e) {
            // Executor rejected the task
            inFlight.remove(modelId);
            run.outcome.complete(ProbeResult.failure("Probe not scheduled: " + e.getMessage()));
        }
        return applied;
    }

    /**
     * One probe on a worker thread. The timeout starts when the worker picks
     * the task up, so time spent queued behind other probes never counts
     * against this model. On timeout the worker is interrupted; the model
     * stays in flight until the worker has actually returned.
     */
    private final class ProbeRun implements Runnable {

        private final ModelConfig config;
        private final long timeoutMs;
        private final CompletableFuture<ProbeResult> outcome = new CompletableFuture<>();
        private Thread worker;

        private ProbeRun(ModelConfig config, long timeoutMs) {
            this.config = config;
            this.timeoutMs = timeoutMs;
        }

        @Override
        public void run() {
            String modelId = config.getModelId();
            synchronized (this) {
                worker = Thread.currentThread();
            }
            outcome.orTimeout(timeoutMs, TimeUnit.MILLISECONDS);

            ProbeResult result = ProbeResult.failure("Probe aborted");
            try {
                result = runProbe(config);
            } finally {
                synchronized (this) {
                    worker = null;
                    overdue.remove(modelId);
                }
                // Drop an interrupt that arrived after the probe returned
                Thread.interrupted();
                inFlight.remove(modelId);
                outcome.complete(result);
            }
        }

        private synchronized void interruptWorker() {
            if (worker != null) {
                overdue.add(config.getModelId());
                worker.interrupt();
            }
        }
    }

    private ProbeResult runProbe(ModelConfig config) {
        long started = System.nanoTime();
        try {
            ProbeResult result = modelProbe.probe(config);
            if (result == null) {
                return ProbeResult.failure("Probe returned no result");
            }
            if (result.isSuccess() && result.getLatencyMs() <= 0) {
                return ProbeResult.success(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeResult.failure("Probe interrupted");
        } catch (Exception e) {
            return ProbeResult.failure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private void applyOutcome(String modelId, ProbeResult outcome) {
        Instant now = clock.instant();
        HealthCheck before = modelRegistry.findHealth(modelId).orElse(null);
        HealthCheck after = modelRegistry.updateHealth(modelId, current -> transition(current, outcome, now))
                .orElse(null);
        if (before == null || after == null) {
            return;
        }

        metricsConfig.recordProbe(modelId, outcome.isSuccess() ? "success" : "failure");
        if (!outcome.isSuccess()) {
            log.warn("Probe failed for {}: {} (consecutive failures={})",
                    modelId, outcome.getError(), after.getConsecutiveFailures());
        }
        if (before.getStatus() != ModelStatus.UNAVAILABLE && after.getStatus() == ModelStatus.UNAVAILABLE) {
            log.warn("MODEL UNAVAILABLE: {} after {} consecutive failures, next probe at {}",
                    modelId, after.getConsecutiveFailures(), after.getNextProbeAt());
        } else if (before.getStatus() == ModelStatus.UNAVAILABLE && after.getStatus() == ModelStatus.HEALTHY) {
            log.info("MODEL RECOVERED: {}", modelId);
        }
    }

    HealthCheck transition(HealthCheck current, ProbeResult outcome, Instant now) {
        if (current.getStatus() == ModelStatus.MAINTENANCE) {
            return current;
        }
        RoutingProperties.Health cfg = routingProperties.getHealth();
        double alpha = cfg.getSuccessRateAlpha();

        if (outcome.isSuccess()) {
            return current.toBuilder()
                    .status(ModelStatus.HEALTHY)
                    .latencyMs(outcome.getLatencyMs())
                    .successRate(alpha + (1 - alpha) * current.getSuccessRate())
                    .consecutiveFailures(0)
                    .lastCheck(now)
                    .nextProbeAt(null)
                    .build();
        }

        int failures = current.getConsecutiveFailures() + 1;
        boolean unavailable = failures >= cfg.getFailuresUntilUnavailable();
        return current.toBuilder()
                .status(unavailable ? ModelStatus.UNAVAILABLE : ModelStatus.DEGRADED)
                .successRate((1 - alpha) * current.getSuccessRate())
                .consecutiveFailures(failures)
                .lastCheck(now)
                .nextProbeAt(unavailable ? now.plus(recoveryBackoff(failures)) : null)
                .build();
    }

    /**
     * base × 2^(failures − threshold), capped.
     */
    Duration recoveryBackoff(int failures) {
        RoutingProperties.Health cfg = routingProperties.getHealth();
        int exponent = Math.min(20, Math.max(0, failures - cfg.getFailuresUntilUnavailable()));
        long delay = cfg.getRecoveryBackoffBaseMs() * (1L << exponent);
        return Duration.ofMillis(Math.min(delay, cfg.getRecoveryBackoffMaxMs()));
    }

    private ModelRegistry.Entry requireModel(String modelId) {
        return modelRegistry.find(modelId)
                .orElseThrow(() -> new InvalidValueException("model_id", "Unknown model: " + modelId));
    }

    private int updateUnavailableGauge(List<HealthCheck> health) {
        int unavailable = (int) health.stream().filter(h -> h.getStatus() == ModelStatus.UNAVAILABLE).count();
        metricsConfig.updateUnavailableModelCount(unavailable);
        return unavailable;
    }

    private static String describe(Throwable error, long timeoutMs) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof TimeoutException) {
            return "Probe timed out after " + timeoutMs + "ms";
        }
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }
}
