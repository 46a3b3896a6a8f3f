package com.ai.guardrails.repository;

import com.ai.guardrails.model.AttackVector;
import com.ai.guardrails.model.ThreatCategory;
import com.ai.guardrails.model.ThreatLevel;
import com.ai.guardrails.seeder.DefaultAttackVectors;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AttackVectorRegistryTest {

    @Test
    void register_defaults_compiledInRegistrationOrder() {
        AttackVectorRegistry registry = new AttackVectorRegistry();
        DefaultAttackVectors.all().forEach(registry::register);

        assertThat(registry.size()).isEqualTo(7);
        assertThat(registry.findAll()).extracting(AttackVector::getVectorId).containsExactly(
                "PRMPT-INJ-001", "PRMPT-INJ-002", "JAILBREAK-001", "JAILBREAK-002",
                "DATA-EXFIL-001", "MODEL-MANIP-001", "API-ABUSE-001");
        assertThat(registry.compiled().get(0).signatures().size()).isEqualTo(3);
        assertThat(registry.findById("API-ABUSE-001").orElseThrow().getDetectionSignatures()).isEmpty();
        assertThat(registry.findById("missing")).isEmpty();
    }

    @Test
    void register_invalidSignature_rejectedAndRegistryUnchanged() {
        AttackVectorRegistry registry = new AttackVectorRegistry();
        AttackVector broken = AttackVector.builder()
                .vectorId("BROKEN-1")
                .name("Broken")
                .category(ThreatCategory.ADVERSARIAL_INPUT)
                .severity(ThreatLevel.LOW)
                .detectionSignatures(List.of("(unclosed"))
                .prevalenceScore(0.1)
                .build();

        assertThatThrownBy(() -> registry.register(broken)).isInstanceOf(IllegalArgumentException.class);
        assertThat(registry.size()).isZero();
    }

    @Test
    void attackVector_prevalenceOutOfRange_rejected() {
        assertThatThrownBy(() -> AttackVector.builder().vectorId("X").prevalenceScore(1.5).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void attackVector_markSeenOutOfOrder_keepsLatest() {
        AttackVector vector = AttackVector.builder().vectorId("X").prevalenceScore(0.5).build();
        Instant earlier = Instant.parse("2024-06-01T00:00:00Z");
        Instant later = earlier.plusSeconds(60);

        vector.markSeen(later);
        vector.markSeen(earlier);
        vector.markSeen(null);

        assertThat(vector.getLastSeen()).isEqualTo(later);
    }

    @Test
    void attackVector_concurrentMarkSeen_endsAtMaximum() throws Exception {
        AttackVector vector = AttackVector.builder().vectorId("X").prevalenceScore(0.5).build();
        Instant base = Instant.parse("2024-06-01T00:00:00Z");
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<Void>> marks = new ArrayList<>();
            for (int i = 999; i >= 0; i--) {
                Instant when = base.plusSeconds(i);
                marks.add(() -> {
                    vector.markSeen(when);
                    return null;
                });
            }
            pool.invokeAll(marks);
        } finally {
            pool.shutdownNow();
        }

        assertThat(vector.getLastSeen()).isEqualTo(base.plusSeconds(999));
    }
}
