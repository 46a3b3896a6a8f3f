package com.ai.guardrails.service;

import com.ai.guardrails.config.GuardrailProperties;
import com.ai.guardrails.config.MetricsConfig;
import com.ai.guardrails.exception.InvalidValueException;
import com.ai.guardrails.model.AttackVector;
import com.ai.guardrails.model.AttackVectorStats;
import com.ai.guardrails.model.InvestigationStatus;
import com.ai.guardrails.model.SecurityIncident;
import com.ai.guardrails.model.ThreatCategory;
import com.ai.guardrails.model.ThreatIntelligence;
import com.ai.guardrails.model.ThreatLevel;
import com.ai.guardrails.repository.AttackVectorRegistry;
import com.ai.guardrails.repository.IncidentRepository;
import com.ai.guardrails.repository.ThreatIntelligenceLog;
import com.ai.guardrails.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Matches content against the attack vector registry and records incidents.
 *
 * A vector yields at most one intelligence entry per scan however many of its
 * signatures hit. Incidents are only created on explicit request.
 */
@Service
public class ThreatIntelligenceService {

    private static final Logger log = LoggerFactory.getLogger(ThreatIntelligenceService.class);

    static final String SOURCE = "red_team_detection";
    static final String UNKNOWN_MODEL = "unknown";

    private final AttackVectorRegistry vectorRegistry;
    private final ThreatIntelligenceLog intelligenceLog;
    private final IncidentRepository incidentRepository;
    private final GuardrailProperties properties;
    private final MetricsConfig metricsConfig;
    private final Clock clock;
    private final AtomicLong incidentSequence = new AtomicLong();

    public ThreatIntelligenceService(AttackVectorRegistry vectorRegistry,
                                     ThreatIntelligenceLog intelligenceLog,
                                     IncidentRepository incidentRepository,
                                     GuardrailProperties properties,
                                     MetricsConfig metricsConfig,
                                     Clock clock) {
        this.vectorRegistry = vectorRegistry;
        this.intelligenceLog = intelligenceLog;
        this.incidentRepository = incidentRepository;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    public List<ThreatIntelligence> analyze(String content) {
        return analyze(content, null);
    }

    /**
     * Scan content against every registered vector.
     *
     * @param modelId model the content is addressed to, recorded as the affected model
     * @return one entry per matching vector, in registration order
     */
    public List<ThreatIntelligence> analyze(String content, String modelId) {
        String text = content == null ? "" : content;
        List<ThreatIntelligence> detected = new ArrayList<>();

        for (AttackVectorRegistry.Entry entry : vectorRegistry.compiled()) {
            List<String> indicators = entry.signatures().matchingSignatures(text);
            if (indicators.isEmpty()) {
                continue;
            }

            AttackVector vector = entry.vector();
            Instant now = clock.instant();
            ThreatIntelligence intel = ThreatIntelligence.builder()
                    .threatId(threatId(text, vector.getVectorId(), now))
                    .timestamp(now)
                    .source(SOURCE)
                    .threatLevel(vector.getSeverity())
                    .category(vector.getCategory())
                    .indicators(indicators)
                    .affectedModels(List.of(modelId == null || modelId.isBlank() ? UNKNOWN_MODEL : modelId))
                    .attackPattern(vector.getName())
                    .recommendedActions(vector.getMitigationStrategies())
                    .build();

            vector.markSeen(now);
            intelligenceLog.append(intel);
            metricsConfig.recordThreatDetected(vector.getVectorId());
            log.info("Threat detected: vector={}, level={}, indicators={}",
                    vector.getVectorId(), vector.getSeverity(), indicators.size());
            detected.add(intel);
        }
        return detected;
    }

    /**
     * Record a security incident. The payload is truncated to the configured
     * excerpt length; status starts at NEW.
     */
    public SecurityIncident createIncident(String subject, ThreatCategory category, ThreatLevel level,
                                           String attackVector, String payload, List<String> detectedBy,
                                           boolean blocked) {
        if (subject == null || subject.isBlank()) {
            throw new InvalidValueException("subject", "Incident requires a subject identity");
        }
        Instant now = clock.instant();
        String excerpt = payload == null ? "" : payload;
        if (excerpt.length() > properties.getIncidentPayloadLimit()) {
            excerpt = excerpt.substring(0, properties.getIncidentPayloadLimit());
        }

        SecurityIncident incident = SecurityIncident.builder()
                .incidentId(incidentId(now))
                .timestamp(now)
                .subject(subject)
                .threatCategory(category)
                .threatLevel(level)
                .attackVector(attackVector)
                .payload(excerpt)
                .detectedBy(detectedBy == null ? List.of() : List.copyOf(detectedBy))
                .blocked(blocked)
                .investigationStatus(InvestigationStatus.NEW)
                .build();

        incidentRepository.save(incident);
        log.warn("Security incident {}: subject={}, vector={}, level={}, blocked={}",
                incident.getIncidentId(), subject, attackVector, level, blocked);
        return incident;
    }

    public void registerAttackVector(AttackVector vector) {
        vectorRegistry.register(vector);
    }

    public List<AttackVector> listAttackVectors() {
        return vectorRegistry.findAll();
    }

    /**
     * Per-vector incident totals, busiest first. Incidents reference vectors by name.
     */
    public List<AttackVectorStats> getAttackVectorStats() {
        Map<String, int[]> countsByName = new HashMap<>();
        for (SecurityIncident incident : incidentRepository.findAll()) {
            countsByName.computeIfAbsent(incident.getAttackVector(), k -> new int[1])[0]++;
        }

        List<AttackVectorStats> stats = new ArrayList<>();
        for (AttackVector vector : vectorRegistry.findAll()) {
            int[] count = countsByName.get(vector.getName());
            stats.add(AttackVectorStats.builder()
                    .vectorId(vector.getVectorId())
                    .name(vector.getName())
                    .category(vector.getCategory())
                    .severity(vector.getSeverity())
                    .prevalence(vector.getPrevalenceScore())
                    .totalIncidents(count == null ? 0 : count[0])
                    .lastSeen(vector.getLastSeen())
                    .build());
        }
        // Stable sort keeps registration order among equal counts
        stats.sort(Comparator.comparingInt(AttackVectorStats::getTotalIncidents).reversed());
        return stats;
    }

    public List<SecurityIncident> getRecentIncidents(int limit) {
        if (limit <= 0) {
            throw new InvalidValueException("limit", "Limit must be positive: " + limit);
        }
        return incidentRepository.findRecent(limit);
    }

    public List<ThreatIntelligence> getRecentIntelligence(int limit) {
        return intelligenceLog.findRecent(limit);
    }

    private static String threatId(String content, String vectorId, Instant now) {
        String head = content.length() > 100 ? content.substring(0, 100) : content;
        return Hashing.sha256Hex(head, vectorId, now.toString()).substring(0, 16);
    }

    private String incidentId(Instant now) {
        String hash = Hashing.sha256Hex(String.valueOf(incidentSequence.incrementAndGet()), now.toString());
        return "INC-" + hash.substring(0, 12).toUpperCase(Locale.ROOT);
    }
}
