package com.ai.guardrails.engine.detectors;

import com.ai.guardrails.engine.ToxicityDetector;
import com.ai.guardrails.model.ToxicityCategory;
import com.ai.guardrails.model.ToxicityFinding;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Word-list profanity check. Score grows with the number of whole-word hits:
 * {@code min(1.0, 0.3 + 0.1 * hits)}.
 */
@Component
public class ProfanityDetector implements ToxicityDetector {

    private static final Set<String> WORDS = Set.of(
            "fuck", "shit", "ass", "bitch", "damn", "bastard", "crap",
            "piss", "dick", "pussy", "cock", "whore", "slut", "fag");

    private static final Pattern WORD = Pattern.compile("\\b\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    @Override
    public ToxicityCategory getCategory() {
        return ToxicityCategory.PROFANITY;
    }

    @Override
    public Optional<ToxicityFinding> detect(String content) {
        Matcher m = WORD.matcher(content);
        int hits = 0;
        Set<String> matched = new LinkedHashSet<>();
        while (m.find()) {
            String word = m.group().toLowerCase(Locale.ROOT);
            if (WORDS.contains(word)) {
                hits++;
                matched.add(word);
            }
        }
        if (hits == 0) {
            return Optional.empty();
        }
        return Optional.of(ToxicityFinding.builder()
                .category(ToxicityCategory.PROFANITY)
                .score(Math.min(1.0, 0.3 + 0.1 * hits))
                .matches(new ArrayList<>(matched))
                .build());
    }
}
