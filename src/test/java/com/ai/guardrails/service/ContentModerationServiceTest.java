package com.ai.guardrails.service;

import com.ai.guardrails.config.GuardrailProperties;
import com.ai.guardrails.model.ModerationResult;
import com.ai.guardrails.model.ToxicityCategory;
import com.ai.guardrails.model.ToxicityLevel;
import com.ai.guardrails.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ContentModerationServiceTest {

    private ContentModerationService service;

    @BeforeEach
    void setUp() {
        GuardrailProperties properties = new GuardrailProperties();
        service = new ContentModerationService(TestDataFactory.detectorEngine(properties), properties);
    }

    @Test
    void moderate_hateSpeech_severeAndBlocked() {
        ModerationResult result = service.moderate("They talk about the master race");

        assertThat(result.getToxicityScore()).isEqualTo(1.0);
        assertThat(result.getToxicityLevel()).isEqualTo(ToxicityLevel.SEVERE);
        assertThat(result.isToxic()).isTrue();
        assertThat(result.isShouldBlock()).isTrue();
        assertThat(result.getCategories()).containsExactly(ToxicityCategory.HATE_SPEECH);
        assertThat(result.getRedactedContent()).isEqualTo("They talk about the ***********");

        ModerationResult strict = service.moderate("They talk about the master race", true);
        assertThat(strict.getToxicityScore()).isEqualTo(1.0);
        assertThat(strict.getToxicityLevel()).isEqualTo(ToxicityLevel.SEVERE);
        assertThat(strict.isShouldBlock()).isTrue();
    }

    @Test
    void moderate_threatAndViolence_maxScoreAndMergedRedaction() {
        ModerationResult result = service.moderate("I will kill them all");

        assertThat(result.getToxicityScore()).isEqualTo(0.95);
        assertThat(result.getToxicityLevel()).isEqualTo(ToxicityLevel.SEVERE);
        assertThat(result.getCategories())
                .containsExactlyInAnyOrder(ToxicityCategory.VIOLENCE, ToxicityCategory.THREAT);
        assertThat(result.getFlaggedContent()).containsExactlyInAnyOrder("kill them", "I will kill");
        assertThat(result.getRedactedContent()).isEqualTo("**************** all");
    }

    @Test
    void moderate_moderateContent_toxicOnlyInStrictMode() {
        String text = "send nude pictures";

        ModerationResult relaxed = service.moderate(text);
        assertThat(relaxed.getToxicityScore()).isEqualTo(0.6);
        assertThat(relaxed.getToxicityLevel()).isEqualTo(ToxicityLevel.MODERATE);
        assertThat(relaxed.isToxic()).isFalse();
        assertThat(relaxed.isShouldBlock()).isFalse();

        ModerationResult strict = service.moderate(text, true);
        assertThat(strict.isToxic()).isTrue();
        assertThat(strict.isShouldBlock()).isFalse();
        assertThat(strict.getRedactedContent()).isNull();
    }

    @Test
    void moderate_profanity_scaledScore() {
        ModerationResult result = service.moderate("damn this damn crap");

        assertThat(result.getToxicityScore()).isCloseTo(0.6, within(1e-9));
        assertThat(result.getCategories()).containsExactly(ToxicityCategory.PROFANITY);
        assertThat(result.getFlaggedContent()).containsExactly("damn", "crap");
    }

    @Test
    void moderate_cleanText_clean() {
        ModerationResult result = service.moderate("Have a lovely weekend");

        assertThat(result.getToxicityScore()).isZero();
        assertThat(result.getToxicityLevel()).isEqualTo(ToxicityLevel.CLEAN);
        assertThat(result.isToxic()).isFalse();
        assertThat(result.getCategories()).isEmpty();
        assertThat(result.getFlaggedContent()).isEmpty();
        assertThat(result.getRedactedContent()).isNull();
    }
}
