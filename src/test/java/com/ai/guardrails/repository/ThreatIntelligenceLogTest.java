package com.ai.guardrails.repository;

import com.ai.guardrails.config.GuardrailProperties;
import com.ai.guardrails.model.ThreatCategory;
import com.ai.guardrails.model.ThreatIntelligence;
import com.ai.guardrails.model.ThreatLevel;
import com.ai.guardrails.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ThreatIntelligenceLogTest {

    @Test
    void append_beyondCapacity_evictsOldest() {
        GuardrailProperties properties = new GuardrailProperties();
        properties.setIntelligenceLogCapacity(2);
        ThreatIntelligenceLog log = new ThreatIntelligenceLog(properties);

        log.append(TestDataFactory.createThreat("first", ThreatCategory.JAILBREAK, ThreatLevel.HIGH));
        log.append(TestDataFactory.createThreat("second", ThreatCategory.JAILBREAK, ThreatLevel.HIGH));
        log.append(TestDataFactory.createThreat("third", ThreatCategory.JAILBREAK, ThreatLevel.HIGH));

        assertThat(log.size()).isEqualTo(2);
        assertThat(log.findRecent(10)).extracting(ThreatIntelligence::getAttackPattern)
                .containsExactly("third", "second");
        assertThat(log.findRecent(1)).extracting(ThreatIntelligence::getAttackPattern).containsExactly("third");
    }
}
