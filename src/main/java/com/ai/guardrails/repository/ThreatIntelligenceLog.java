package com.ai.guardrails.repository;

import com.ai.guardrails.config.GuardrailProperties;
import com.ai.guardrails.model.ThreatIntelligence;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Append-only, bounded log of threat intelligence. Oldest entries are
 * evicted once capacity is reached.
 */
@Repository
public class ThreatIntelligenceLog {

    private final ConcurrentLinkedDeque<ThreatIntelligence> entries = new ConcurrentLinkedDeque<>();
    private final AtomicInteger size = new AtomicInteger();
    private final int capacity;

    public ThreatIntelligenceLog(GuardrailProperties properties) {
        this.capacity = properties.getIntelligenceLogCapacity();
    }

    public void append(ThreatIntelligence intel) {
        entries.addLast(intel);
        if (size.incrementAndGet() > capacity) {
            if (entries.pollFirst() != null) {
                size.decrementAndGet();
            }
        }
    }

    /**
     * Most recent entries first.
     */
    public List<ThreatIntelligence> findRecent(int limit) {
        List<ThreatIntelligence> result = new ArrayList<>();
        Iterator<ThreatIntelligence> it = entries.descendingIterator();
        while (it.hasNext() && result.size() < limit) {
            result.add(it.next());
        }
        return result;
    }

    public int size() {
        return size.get();
    }
}
