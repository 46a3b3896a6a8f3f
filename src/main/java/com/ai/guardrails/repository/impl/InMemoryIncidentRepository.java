package com.ai.guardrails.repository.impl;

import com.ai.guardrails.model.SecurityIncident;
import com.ai.guardrails.repository.IncidentRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

@Repository
public class InMemoryIncidentRepository implements IncidentRepository {

    private final ConcurrentLinkedDeque<SecurityIncident> incidents = new ConcurrentLinkedDeque<>();

    @Override
    public SecurityIncident save(SecurityIncident incident) {
        incidents.addLast(incident);
        return incident;
    }

    @Override
    public List<SecurityIncident> findBetween(Instant start, Instant end) {
        return incidents.stream()
                .filter(i -> !i.getTimestamp().isBefore(start) && !i.getTimestamp().isAfter(end))
                .toList();
    }

    @Override
    public List<SecurityIncident> findRecent(int limit) {
        List<SecurityIncident> result = new ArrayList<>();
        Iterator<SecurityIncident> it = incidents.descendingIterator();
        while (it.hasNext() && result.size() < limit) {
            result.add(it.next());
        }
        return result;
    }

    @Override
    public List<SecurityIncident> findAll() {
        return List.copyOf(incidents);
    }
}
