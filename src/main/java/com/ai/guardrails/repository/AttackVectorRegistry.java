package com.ai.guardrails.repository;

import com.ai.guardrails.engine.SignatureTable;
import com.ai.guardrails.model.AttackVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Registry of attack vectors keyed by vector id, kept in registration order.
 *
 * Signatures are compiled once on registration. Readers always see a
 * complete, immutable snapshot; re-registering an id replaces the entry in
 * place.
 */
@Repository
public class AttackVectorRegistry {

    private static final Logger log = LoggerFactory.getLogger(AttackVectorRegistry.class);

    public record Entry(AttackVector vector, SignatureTable signatures) {}

    private final AtomicReference<List<Entry>> entries = new AtomicReference<>(List.of());

    public void register(AttackVector vector) {
        Entry entry = new Entry(vector, SignatureTable.compile(vector.getDetectionSignatures()));
        entries.updateAndGet(current -> {
            List<Entry> next = new ArrayList<>(current);
            int existing = indexOf(next, vector.getVectorId());
            if (existing >= 0) {
                next.set(existing, entry);
            } else {
                next.add(entry);
            }
            return List.copyOf(next);
        });
        log.info("Registered attack vector: {} ({}, {} signatures)",
                vector.getVectorId(), vector.getSeverity(), entry.signatures().size());
    }

    public Optional<AttackVector> findById(String vectorId) {
        List<Entry> current = entries.get();
        int idx = indexOf(current, vectorId);
        return idx >= 0 ? Optional.of(current.get(idx).vector()) : Optional.empty();
    }

    public List<AttackVector> findAll() {
        return entries.get().stream().map(Entry::vector).toList();
    }

    /**
     * Snapshot of vectors with their compiled signatures, for scanning.
     */
    public List<Entry> compiled() {
        return entries.get();
    }

    public int size() {
        return entries.get().size();
    }

    private static int indexOf(List<Entry> list, String vectorId) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i).vector().getVectorId().equals(vectorId)) {
                return i;
            }
        }
        return -1;
    }
}
