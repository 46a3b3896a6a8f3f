package com.ai.guardrails.engine.detectors;

import com.ai.guardrails.model.ToxicityCategory;
import com.ai.guardrails.model.ToxicityFinding;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ToxicityDetectorsTest {

    @Test
    void hateSpeech_scoresOne() {
        ToxicityFinding finding = new HateSpeechDetector().detect("They keep talking about the master race").orElseThrow();

        assertThat(finding.getCategory()).isEqualTo(ToxicityCategory.HATE_SPEECH);
        assertThat(finding.getScore()).isEqualTo(1.0);
        assertThat(finding.getMatches()).containsExactly("master race");
    }

    @Test
    void profanity_scoreScalesWithWholeWordHits() {
        ToxicityFinding finding = new ProfanityDetector().detect("damn this damn crap").orElseThrow();

        // 0.3 + 0.1 * 3 hits
        assertThat(finding.getScore()).isCloseTo(0.6, within(1e-9));
        assertThat(finding.getMatches()).containsExactly("damn", "crap");
    }

    @Test
    void profanity_scoreCappedAtOne() {
        ToxicityFinding finding = new ProfanityDetector()
                .detect("crap crap crap crap crap crap crap crap crap").orElseThrow();

        assertThat(finding.getScore()).isEqualTo(1.0);
    }

    @Test
    void profanity_ignoresSubstringsOfLongerWords() {
        assertThat(new ProfanityDetector().detect("The class assessment passes")).isEmpty();
    }

    @Test
    void threat_statementOfIntent_detected() {
        ToxicityFinding finding = new ThreateningLanguageDetector().detect("I'm going to hurt you").orElseThrow();

        assertThat(finding.getCategory()).isEqualTo(ToxicityCategory.THREAT);
        assertThat(finding.getScore()).isEqualTo(0.95);
    }

    @Test
    void fixedScoreCategories_haveExpectedScores() {
        assertThat(new ViolenceDetector().detect("they tortured the prisoners").orElseThrow().getScore())
                .isEqualTo(0.8);
        assertThat(new HarassmentDetector().detect("you are such a stupid person").orElseThrow().getScore())
                .isEqualTo(0.75);
        assertThat(new SexualContentDetector().detect("send nude pictures").orElseThrow().getScore())
                .isEqualTo(0.6);
        assertThat(new IdentityAttackDetector().detect("what a typical woman thing to say").orElseThrow().getScore())
                .isEqualTo(0.8);
    }

    @Test
    void cleanText_firesNothing() {
        String text = "Thanks for the detailed explanation of sorting algorithms";

        assertThat(new HateSpeechDetector().detect(text)).isEmpty();
        assertThat(new ProfanityDetector().detect(text)).isEmpty();
        assertThat(new ViolenceDetector().detect(text)).isEmpty();
        assertThat(new ThreateningLanguageDetector().detect(text)).isEmpty();
        assertThat(new SexualContentDetector().detect(text)).isEmpty();
    }
}
