package com.ai.guardrails.engine;

import com.ai.guardrails.config.MetricsConfig;
import com.ai.guardrails.model.ContentDirection;
import com.ai.guardrails.model.RiskCategory;
import com.ai.guardrails.model.RiskFactor;
import com.ai.guardrails.model.ToxicityCategory;
import com.ai.guardrails.model.ToxicityFinding;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the registered detectors over one input.
 * Each category is handled by exactly one registered detector; detectors run
 * in category declaration order so results are reproducible.
 */
@Component
public class DetectorEngine {

    private static final Logger log = LoggerFactory.getLogger(DetectorEngine.class);

    private final Map<RiskCategory, RiskDetector> riskDetectors;
    private final Map<ToxicityCategory, ToxicityDetector> toxicityDetectors;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    @Autowired
    public DetectorEngine(List<RiskDetector> riskDetectors, List<ToxicityDetector> toxicityDetectors,
                          ObjectProvider<Tracer> tracer, MetricsConfig metricsConfig) {
        // Tracing may be switched off, in which case spans are no-ops
        this(riskDetectors, toxicityDetectors, tracer.getIfAvailable(() -> Tracer.NOOP), metricsConfig);
    }

    public DetectorEngine(List<RiskDetector> riskDetectors, List<ToxicityDetector> toxicityDetectors,
                          Tracer tracer, MetricsConfig metricsConfig) {
        this.riskDetectors = new EnumMap<>(RiskCategory.class);
        this.toxicityDetectors = new EnumMap<>(ToxicityCategory.class);
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        // Auto-register all detector implementations
        for (RiskDetector detector : riskDetectors) {
            register(this.riskDetectors, detector);
        }
        for (ToxicityDetector detector : toxicityDetectors) {
            register(this.toxicityDetectors, detector);
        }
    }

    /**
     * Run every risk detector scoped to the given direction.
     *
     * @return one factor per detector that fired
     */
    public List<RiskFactor> detectRisks(String content, ContentDirection direction) {
        String text = content == null ? "" : content;
        List<RiskFactor> factors = new ArrayList<>();
        for (RiskDetector detector : riskDetectors.values()) {
            if (detector.getDirections().contains(direction)) {
                run(detector, text).ifPresent(factors::add);
            }
        }
        return factors;
    }

    /**
     * Run every toxicity detector.
     *
     * @return one finding per detector that fired
     */
    public List<ToxicityFinding> detectToxicity(String content) {
        String text = content == null ? "" : content;
        List<ToxicityFinding> findings = new ArrayList<>();
        for (ToxicityDetector detector : toxicityDetectors.values()) {
            run(detector, text).ifPresent(findings::add);
        }
        return findings;
    }

    private <C extends Enum<C>, F> Optional<F> run(SignalDetector<C, F> detector, String text) {
        String category = detector.getCategory().name();
        Span span = tracer.nextSpan()
                .name("detector." + category)
                .tag("detector.class", detector.getClass().getSimpleName())
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            Optional<F> finding = detector.detect(text);
            span.tag("detector.fired", String.valueOf(finding.isPresent()));
            if (finding.isPresent()) {
                metricsConfig.recordDetectorFired(category);
                log.debug("Detector fired: {}", category);
            }
            return finding;
        } catch (Exception e) {
            span.error(e);
            log.error("Detector {} failed: {}", category, e.getMessage(), e);
            // A faulty detector is skipped; the remaining detectors still run
            return Optional.empty();
        } finally {
            span.end();
        }
    }

    private static <C extends Enum<C>, D extends SignalDetector<C, ?>> void register(Map<C, D> registry, D detector) {
        D previous = registry.put(detector.getCategory(), detector);
        if (previous != null) {
            throw new IllegalStateException("Two detectors registered for " + detector.getCategory()
                    + ": " + previous.getClass().getSimpleName() + ", " + detector.getClass().getSimpleName());
        }
        log.info("Registered detector: {} -> {}", detector.getCategory(), detector.getClass().getSimpleName());
    }
}
