package com.ai.guardrails.service;

import com.ai.guardrails.client.ModelProbe;
import com.ai.guardrails.config.RoutingProperties;
import com.ai.guardrails.exception.InvalidValueException;
import com.ai.guardrails.model.HealthCheck;
import com.ai.guardrails.model.ModelCapability;
import com.ai.guardrails.model.ModelConfig;
import com.ai.guardrails.model.ModelProvider;
import com.ai.guardrails.model.ModelStats;
import com.ai.guardrails.model.ModelStatus;
import com.ai.guardrails.model.ProbeResult;
import com.ai.guardrails.repository.ModelRegistry;
import com.ai.guardrails.testutil.MutableClock;
import com.ai.guardrails.testutil.TestDataFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.ai.guardrails.testutil.TestDataFactory.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ModelHealthServiceTest {

    private static final String MODEL = "model-a";

    private ExecutorService executor;
    private MutableClock clock;
    private ModelRegistry registry;
    private RoutingProperties properties;
    private ScriptedProbe probe;
    private ModelHealthService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        clock = new MutableClock(NOW);
        registry = new ModelRegistry(clock);
        registry.register(TestDataFactory.createModel(MODEL, ModelProvider.OPENAI, 90, 0.01, ModelCapability.CHAT));
        registry.register(TestDataFactory.createModel("model-b", ModelProvider.ANTHROPIC, 80, 0.01, ModelCapability.CHAT));
        properties = new RoutingProperties();
        probe = new ScriptedProbe();
        service = new ModelHealthService(registry, probe, executor, properties, TestDataFactory.metrics(), clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void checkModel_success_healthyWithProbeLatency() {
        probe.respond(MODEL, ProbeResult.success(120));

        HealthCheck health = service.checkModel(MODEL);

        assertThat(health.getStatus()).isEqualTo(ModelStatus.HEALTHY);
        assertThat(health.getLatencyMs()).isEqualTo(120);
        assertThat(health.getSuccessRate()).isCloseTo(1.0, within(1e-9));
        assertThat(health.getConsecutiveFailures()).isZero();
    }

    @Test
    void checkModel_singleFailure_degraded() {
        probe.respond(MODEL, ProbeResult.failure("HTTP 503"));

        HealthCheck health = service.checkModel(MODEL);

        assertThat(health.getStatus()).isEqualTo(ModelStatus.DEGRADED);
        assertThat(health.getConsecutiveFailures()).isEqualTo(1);
        assertThat(health.getSuccessRate()).isCloseTo(0.9, within(1e-9));
        assertThat(health.getNextProbeAt()).isNull();
    }

    @Test
    void checkModel_probeThrows_countsAsFailure() {
        probe.fail(MODEL, new IllegalStateException("connection refused"));

        assertThat(service.checkModel(MODEL).getStatus()).isEqualTo(ModelStatus.DEGRADED);
    }

    @Test
    void checkModel_probeTimesOut_countsAsFailure() {
        properties.getHealth().setProbeTimeoutMs(50);
        probe.delay(MODEL, 2_000);

        HealthCheck health = service.checkModel(MODEL);

        assertThat(health.getStatus()).isEqualTo(ModelStatus.DEGRADED);
        assertThat(health.getConsecutiveFailures()).isEqualTo(1);
    }

    @Test
    void checkAll_slowProbeOnSingleThreadPool_queuedSiblingUnaffected() {
        ExecutorService single = Executors.newSingleThreadExecutor();
        try {
            ModelRegistry pair = new ModelRegistry(clock);
            pair.register(TestDataFactory.createModel("slow", ModelProvider.LOCAL, 90, 0.01, ModelCapability.CHAT));
            pair.register(TestDataFactory.createModel("fast", ModelProvider.LOCAL, 80, 0.01, ModelCapability.CHAT));
            properties.getHealth().setProbeTimeoutMs(200);
            probe.delay("slow", 1_500);
            probe.respond("fast", ProbeResult.success(5));
            ModelHealthService isolated = new ModelHealthService(pair, probe, single, properties,
                    TestDataFactory.metrics(), clock);

            List<HealthCheck> health = isolated.checkAll();

            assertThat(health).extracting(HealthCheck::getModelId).containsExactly("slow", "fast");
            assertThat(health.get(0).getStatus()).isEqualTo(ModelStatus.DEGRADED);
            assertThat(health.get(1).getStatus()).isEqualTo(ModelStatus.HEALTHY);
            assertThat(health.get(1).getConsecutiveFailures()).isZero();
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    void checkModel_timedOutProbe_workerInterrupted() throws Exception {
        properties.getHealth().setProbeTimeoutMs(50);
        probe.delay(MODEL, 5_000);

        service.checkModel(MODEL);

        assertThat(probe.interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void checkModel_workerStuckPastTimeout_failsWithoutSecondProbe() {
        properties.getHealth().setProbeTimeoutMs(50);
        probe.hang(MODEL);
        try {
            HealthCheck first = service.checkModel(MODEL);
            HealthCheck second = service.checkModel(MODEL);
            HealthCheck third = service.checkModel(MODEL);

            assertThat(first.getConsecutiveFailures()).isEqualTo(1);
            assertThat(second.getConsecutiveFailures()).isEqualTo(2);
            assertThat(third.getStatus()).isEqualTo(ModelStatus.UNAVAILABLE);
            assertThat(probe.calls(MODEL)).isEqualTo(1);
        } finally {
            probe.release.countDown();
        }
    }

    @Test
    void repeatedFailures_unavailableWithExponentialBackoff() {
        probe.respond(MODEL, ProbeResult.failure("down"));

        service.checkModel(MODEL);
        service.checkModel(MODEL);
        HealthCheck third = service.checkModel(MODEL);

        assertThat(third.getStatus()).isEqualTo(ModelStatus.UNAVAILABLE);
        assertThat(third.getConsecutiveFailures()).isEqualTo(3);
        assertThat(third.getNextProbeAt()).isEqualTo(NOW.plusSeconds(30));

        // still backing off: no probe, no change
        HealthCheck skipped = service.checkModel(MODEL);
        assertThat(skipped.getConsecutiveFailures()).isEqualTo(3);
        assertThat(probe.calls(MODEL)).isEqualTo(3);

        clock.advance(Duration.ofSeconds(30));
        HealthCheck fourth = service.checkModel(MODEL);
        assertThat(fourth.getConsecutiveFailures()).isEqualTo(4);
        assertThat(fourth.getNextProbeAt()).isEqualTo(NOW.plusSeconds(30 + 60));
    }

    @Test
    void unavailableModel_recoversOnSuccessfulTrialProbe() {
        probe.respond(MODEL, ProbeResult.failure("down"));
        for (int i = 0; i < 3; i++) {
            service.checkModel(MODEL);
        }

        clock.advance(Duration.ofMinutes(1));
        probe.respond(MODEL, ProbeResult.success(80));
        HealthCheck health = service.checkModel(MODEL);

        assertThat(health.getStatus()).isEqualTo(ModelStatus.HEALTHY);
        assertThat(health.getConsecutiveFailures()).isZero();
        assertThat(health.getNextProbeAt()).isNull();
    }

    @Test
    void maintenance_neverProbedNorChangedByProbes() {
        probe.respond(MODEL, ProbeResult.failure("down"));
        service.updateModelStatus(MODEL, "maintenance");

        service.checkAll();
        service.checkAll();

        assertThat(registry.findHealth(MODEL).orElseThrow().getStatus()).isEqualTo(ModelStatus.MAINTENANCE);
        assertThat(probe.calls(MODEL)).isZero();
    }

    @Test
    void updateModelStatus_healthy_clearsFailuresAndBackoff() {
        probe.respond(MODEL, ProbeResult.failure("down"));
        for (int i = 0; i < 3; i++) {
            service.checkModel(MODEL);
        }

        HealthCheck health = service.updateModelStatus(MODEL, ModelStatus.HEALTHY);

        assertThat(health.getStatus()).isEqualTo(ModelStatus.HEALTHY);
        assertThat(health.getConsecutiveFailures()).isZero();
        assertThat(health.getNextProbeAt()).isNull();
    }

    @Test
    void updateModelStatus_invalidInput_rejected() {
        assertThatThrownBy(() -> service.updateModelStatus(MODEL, "sleeping"))
                .isInstanceOf(InvalidValueException.class)
                .hasMessageContaining("status");
        assertThatThrownBy(() -> service.updateModelStatus("nope", ModelStatus.HEALTHY))
                .isInstanceOf(InvalidValueException.class);
        assertThatThrownBy(() -> service.checkModel("nope"))
                .isInstanceOf(InvalidValueException.class)
                .hasMessageContaining("model_id");
    }

    @Test
    void checkAll_probesEveryModelAndReturnsRegistrationOrder() {
        probe.respond(MODEL, ProbeResult.success(10));
        probe.respond("model-b", ProbeResult.failure("down"));

        List<HealthCheck> health = service.checkAll();

        assertThat(health).extracting(HealthCheck::getModelId).containsExactly(MODEL, "model-b");
        assertThat(health).extracting(HealthCheck::getStatus)
                .containsExactly(ModelStatus.HEALTHY, ModelStatus.DEGRADED);
        assertThat(probe.calls(MODEL)).isEqualTo(1);
        assertThat(probe.calls("model-b")).isEqualTo(1);
    }

    @Test
    void getModelStats_combinesConfigAndHealth() {
        probe.respond(MODEL, ProbeResult.failure("down"));
        service.checkModel(MODEL);

        List<ModelStats> stats = service.getModelStats();

        assertThat(stats).hasSize(2);
        ModelStats first = stats.get(0);
        assertThat(first.getModelId()).isEqualTo(MODEL);
        assertThat(first.getPriority()).isEqualTo(90);
        assertThat(first.getStatus()).isEqualTo(ModelStatus.DEGRADED);
        assertThat(first.getConsecutiveFailures()).isEqualTo(1);
        assertThat(first.getCapabilities()).containsExactly(ModelCapability.CHAT);
    }

    @Test
    void recoveryBackoff_doublesAndCaps() {
        assertThat(service.recoveryBackoff(3)).isEqualTo(Duration.ofSeconds(30));
        assertThat(service.recoveryBackoff(4)).isEqualTo(Duration.ofSeconds(60));
        assertThat(service.recoveryBackoff(5)).isEqualTo(Duration.ofSeconds(120));
        assertThat(service.recoveryBackoff(30)).isEqualTo(Duration.ofMinutes(10));
    }

    @Test
    void transition_successRateIsSmoothed() {
        HealthCheck start = HealthCheck.initial(MODEL, NOW).toBuilder().successRate(0.5).build();

        HealthCheck next = service.transition(start, ProbeResult.success(40), NOW);

        assertThat(next.getSuccessRate()).isCloseTo(0.55, within(1e-9));
        assertThat(next.getLatencyMs()).isEqualTo(40);
    }

    /**
     * Probe whose answer per model is set by the test.
     */
    private static class ScriptedProbe implements ModelProbe {

        private final Map<String, ProbeResult> results = new ConcurrentHashMap<>();
        private final Map<String, RuntimeException> errors = new ConcurrentHashMap<>();
        private final Map<String, Long> delays = new ConcurrentHashMap<>();
        private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
        private final Set<String> hanging = ConcurrentHashMap.newKeySet();
        final CountDownLatch interrupted = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);

        void respond(String modelId, ProbeResult result) {
            errors.remove(modelId);
            results.put(modelId, result);
        }

        void fail(String modelId, RuntimeException error) {
            errors.put(modelId, error);
        }

        void delay(String modelId, long millis) {
            delays.put(modelId, millis);
        }

        /** Blocks until {@link #release} opens, ignoring interrupts. */
        void hang(String modelId) {
            hanging.add(modelId);
        }

        int calls(String modelId) {
            AtomicInteger count = calls.get(modelId);
            return count == null ? 0 : count.get();
        }

        @Override
        public ProbeResult probe(ModelConfig config) throws Exception {
            String id = config.getModelId();
            calls.computeIfAbsent(id, k -> new AtomicInteger()).incrementAndGet();
            if (hanging.contains(id)) {
                while (release.getCount() > 0) {
                    try {
                        release.await();
                    } catch (InterruptedException ignored) {
                        // keep hanging
                    }
                }
            }
            Long delay = delays.get(id);
            if (delay != null) {
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    throw e;
                }
            }
            RuntimeException error = errors.get(id);
            if (error != null) {
                throw error;
            }
            return results.getOrDefault(id, ProbeResult.success(1));
        }
    }
}
