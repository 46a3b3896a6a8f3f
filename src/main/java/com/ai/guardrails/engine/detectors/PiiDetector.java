package com.ai.guardrails.engine.detectors;

import com.ai.guardrails.config.GuardrailProperties;
import com.ai.guardrails.engine.RiskDetector;
import com.ai.guardrails.model.ContentDirection;
import com.ai.guardrails.model.RiskCategory;
import com.ai.guardrails.model.RiskFactor;
import com.ai.guardrails.model.RiskLevel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects personal and secret data in either direction.
 *
 * All kinds found are folded into a single factor. Severity is CRITICAL when
 * an SSN, card number or API key is present, otherwise HIGH.
 */
@Component
public class PiiDetector implements RiskDetector {

    private static final Set<String> CRITICAL_KINDS = Set.of("ssn", "credit_card", "api_key");

    private static final Map<String, Pattern> KINDS = new LinkedHashMap<>();

    static {
        int flags = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        KINDS.put("ssn", Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b", flags));
        KINDS.put("credit_card", Pattern.compile("\\b\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4}\\b", flags));
        KINDS.put("email", Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b", flags));
        KINDS.put("phone", Pattern.compile("(?:\\+\\d{1,2}\\s?)?\\(?\\b\\d{3}\\)?[\\s.-]?\\d{3}[\\s.-]?\\d{4}\\b", flags));
        KINDS.put("ip_address", Pattern.compile("\\b(?:\\d{1,3}\\.){3}\\d{1,3}\\b", flags));
        KINDS.put("api_key", Pattern.compile("\\b(?:api[_-]?key|apikey|access[_-]?token)\\s*[:=]\\s*['\"]?[A-Za-z0-9_-]{20,}", flags));
    }

    private final GuardrailProperties properties;

    public PiiDetector(GuardrailProperties properties) {
        this.properties = properties;
    }

    @Override
    public RiskCategory getCategory() {
        return RiskCategory.DATA_LEAKAGE;
    }

    @Override
    public Set<ContentDirection> getDirections() {
        return Set.of(ContentDirection.PROMPT, ContentDirection.RESPONSE);
    }

    @Override
    public Optional<RiskFactor> detect(String content) {
        Map<String, Integer> found = new LinkedHashMap<>();
        for (Map.Entry<String, Pattern> kind : KINDS.entrySet()) {
            int count = countMatches(kind.getValue(), content);
            if (count > 0) {
                found.put(kind.getKey(), count);
            }
        }
        if (found.isEmpty()) {
            return Optional.empty();
        }

        boolean critical = found.keySet().stream().anyMatch(CRITICAL_KINDS::contains);

        List<String> evidence = new ArrayList<>();
        for (Map.Entry<String, Integer> e : found.entrySet()) {
            if (evidence.size() >= properties.getEvidenceLimit()) break;
            evidence.add(String.format("Detected %s: %d occurrence(s)", e.getKey(), e.getValue()));
        }

        return Optional.of(RiskFactor.builder()
                .category(RiskCategory.DATA_LEAKAGE)
                .severity(critical ? RiskLevel.CRITICAL : RiskLevel.HIGH)
                .score(critical ? 90 : 70)
                .confidence(0.95)
                .evidence(evidence)
                .mitigation("Remove or redact " + String.join(", ", found.keySet()) + " before processing")
                .build());
    }

    private static int countMatches(Pattern pattern, String content) {
        Matcher m = pattern.matcher(content);
        int count = 0;
        while (m.find()) {
            count++;
        }
        return count;
    }
}
