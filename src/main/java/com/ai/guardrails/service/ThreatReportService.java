package com.ai.guardrails.service;

import com.ai.guardrails.config.GuardrailProperties;
import com.ai.guardrails.exception.InvalidValueException;
import com.ai.guardrails.model.SecurityIncident;
import com.ai.guardrails.model.ThreatCategory;
import com.ai.guardrails.model.ThreatLevel;
import com.ai.guardrails.model.ThreatReport;
import com.ai.guardrails.repository.IncidentRepository;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Batch rollup of incidents over a time window.
 */
@Service
public class ThreatReportService {

    static final int TOP_VECTORS = 10;
    static final int TOP_TRENDING = 5;
    static final int MAX_RECOMMENDATIONS = 5;

    private static final DateTimeFormatter REPORT_ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

    private final IncidentRepository incidentRepository;
    private final GuardrailProperties properties;
    private final Clock clock;

    public ThreatReportService(IncidentRepository incidentRepository, GuardrailProperties properties, Clock clock) {
        this.incidentRepository = incidentRepository;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Aggregate incidents with {@code start <= timestamp <= end}.
     * A null end means now; a null start means the configured number of days before end.
     */
    public ThreatReport getThreatReport(Instant start, Instant end) {
        Instant now = clock.instant();
        Instant periodEnd = end != null ? end : now;
        Instant periodStart = start != null ? start : periodEnd.minus(Duration.ofDays(properties.getDefaultReportDays()));
        if (periodStart.isAfter(periodEnd)) {
            throw new InvalidValueException("period",
                    "Report start " + periodStart + " is after end " + periodEnd);
        }

        List<SecurityIncident> incidents = incidentRepository.findBetween(periodStart, periodEnd);

        Map<ThreatCategory, Integer> byCategory = new EnumMap<>(ThreatCategory.class);
        Map<ThreatLevel, Integer> byLevel = new EnumMap<>(ThreatLevel.class);
        Map<String, int[]> byVector = new LinkedHashMap<>();
        int blocked = 0;
        for (SecurityIncident incident : incidents) {
            byCategory.merge(incident.getThreatCategory(), 1, Integer::sum);
            byLevel.merge(incident.getThreatLevel(), 1, Integer::sum);
            byVector.computeIfAbsent(incident.getAttackVector(), k -> new int[1])[0]++;
            if (incident.isBlocked()) blocked++;
        }

        return ThreatReport.builder()
                .reportId("RPT-" + REPORT_ID_FORMAT.format(now))
                .generatedAt(now)
                .periodStart(periodStart)
                .periodEnd(periodEnd)
                .totalThreatsDetected(incidents.size())
                .threatsByCategory(byCategory)
                .threatsByLevel(byLevel)
                .topAttackVectors(topKeys(byVector, TOP_VECTORS))
                .blockedAttacks(blocked)
                .unblockedAttacks(incidents.size() - blocked)
                .recommendations(recommendations(incidents, byCategory, byLevel))
                .trendingThreats(trending(incidents, periodStart, periodEnd))
                .build();
    }

    public ThreatReport getThreatReport() {
        return getThreatReport(null, null);
    }

    private List<String> recommendations(List<SecurityIncident> incidents,
                                         Map<ThreatCategory, Integer> byCategory,
                                         Map<ThreatLevel, Integer> byLevel) {
        List<String> recs = new ArrayList<>();

        int critical = byLevel.getOrDefault(ThreatLevel.CRITICAL, 0);
        if (critical > 0) {
            recs.add("URGENT: " + critical + " critical threats detected. Immediate review required.");
        }

        long unblocked = incidents.stream().filter(i -> !i.isBlocked()).count();
        if (unblocked > 0) {
            recs.add("Strengthen defenses: " + unblocked + " attacks were not blocked");
        }

        Map<ThreatCategory, int[]> counts = new LinkedHashMap<>();
        byCategory.forEach((category, count) -> counts.put(category, new int[]{count}));
        for (ThreatCategory category : topKeys(counts, 3)) {
            if (category == ThreatCategory.JAILBREAK) {
                recs.add("Enable advanced jailbreak detection and filtering");
            } else if (category == ThreatCategory.PROMPT_INJECTION) {
                recs.add("Implement strict prompt template isolation");
            } else if (category == ThreatCategory.DATA_EXFILTRATION) {
                recs.add("Review and enhance data protection policies");
            }
        }

        if (recs.isEmpty()) {
            recs.add("No significant threats detected. Continue monitoring.");
        }
        return recs.stream().limit(MAX_RECOMMENDATIONS).toList();
    }

    /**
     * Vectors seen at least twice whose incident count in the later half of
     * the window exceeds the earlier half, fastest growing first.
     */
    private List<String> trending(List<SecurityIncident> incidents, Instant start, Instant end) {
        Instant midpoint = start.plus(Duration.between(start, end).dividedBy(2));

        Map<String, int[]> halves = new LinkedHashMap<>(); // vector -> [earlier, later]
        for (SecurityIncident incident : incidents) {
            int[] counts = halves.computeIfAbsent(incident.getAttackVector(), k -> new int[2]);
            if (incident.getTimestamp().isBefore(midpoint)) {
                counts[0]++;
            } else {
                counts[1]++;
            }
        }

        Map<String, int[]> growth = new LinkedHashMap<>();
        halves.forEach((vector, counts) -> {
            if (counts[0] + counts[1] >= 2 && counts[1] > counts[0]) {
                growth.put(vector, new int[]{counts[1] - counts[0]});
            }
        });
        return topKeys(growth, TOP_TRENDING);
    }

    // Keys by descending count; insertion order breaks ties.
    private static <K> List<K> topKeys(Map<K, int[]> counts, int limit) {
        List<Map.Entry<K, int[]>> entries = new ArrayList<>(counts.entrySet());
        entries.sort((a, b) -> Integer.compare(b.getValue()[0], a.getValue()[0]));
        return entries.stream().limit(limit).map(Map.Entry::getKey).toList();
    }
}
