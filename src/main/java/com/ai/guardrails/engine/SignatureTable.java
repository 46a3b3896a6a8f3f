package com.ai.guardrails.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable list of precompiled, case-insensitive signatures. Shared
 * read-only across threads; {@link Matcher}s are created per call.
 */
public final class SignatureTable {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private final List<Pattern> patterns;

    private SignatureTable(List<Pattern> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    public static SignatureTable compile(String... regexes) {
        return compile(List.of(regexes));
    }

    public static SignatureTable compile(List<String> regexes) {
        List<Pattern> compiled = new ArrayList<>(regexes.size());
        for (String regex : regexes) {
            compiled.add(Pattern.compile(regex, FLAGS));
        }
        return new SignatureTable(compiled);
    }

    public int size() {
        return patterns.size();
    }

    /**
     * Text matched by the first signature (in table order) that occurs in the content.
     */
    public Optional<String> firstMatch(String content) {
        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(content);
            if (m.find()) {
                return Optional.of(m.group());
            }
        }
        return Optional.empty();
    }

    /**
     * Every non-empty match of every signature, in table order then position order.
     */
    public List<String> allMatches(String content) {
        List<String> matches = new ArrayList<>();
        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(content);
            while (m.find()) {
                if (!m.group().isEmpty()) {
                    matches.add(m.group());
                }
            }
        }
        return matches;
    }

    /**
     * Source text of every signature that occurs in the content.
     */
    public List<String> matchingSignatures(String content) {
        List<String> sources = new ArrayList<>();
        for (Pattern pattern : patterns) {
            if (pattern.matcher(content).find()) {
                sources.add(pattern.pattern());
            }
        }
        return sources;
    }
}
