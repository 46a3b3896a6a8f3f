package com.ai.guardrails.repository;

import com.ai.guardrails.model.SecurityIncident;

import java.time.Instant;
import java.util.List;

/**
 * Storage port for security incidents. The durable case-management store
 * lives outside this service; the default binding keeps incidents in memory.
 */
public interface IncidentRepository {

    SecurityIncident save(SecurityIncident incident);

    /**
     * Incidents with {@code start <= timestamp <= end}, in creation order.
     */
    List<SecurityIncident> findBetween(Instant start, Instant end);

    /**
     * Most recent incidents first.
     */
    List<SecurityIncident> findRecent(int limit);

    List<SecurityIncident> findAll();
}
