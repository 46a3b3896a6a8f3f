package com.ai.guardrails.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks flagged substrings with equal-length filler.
 *
 * All occurrences of every flagged item are located first (case-insensitive)
 * and merged into non-overlapping spans; substitution happens once over the
 * merged spans, so overlapping flags such as "kill" and "kill all" cannot
 * corrupt each other.
 */
public final class Redactor {

    public static final char MASK = '*';

    private Redactor() {}

    public static String redact(String content, Collection<String> flagged) {
        if (content == null || content.isEmpty() || flagged == null || flagged.isEmpty()) {
            return content;
        }

        List<int[]> spans = new ArrayList<>();
        for (String item : flagged) {
            if (item == null || item.isEmpty()) continue;
            Matcher m = Pattern.compile(Pattern.quote(item), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
                    .matcher(content);
            while (m.find()) {
                spans.add(new int[]{m.start(), m.end()});
            }
        }
        if (spans.isEmpty()) {
            return content;
        }

        char[] out = content.toCharArray();
        for (int[] span : merge(spans)) {
            for (int i = span[0]; i < span[1]; i++) {
                out[i] = MASK;
            }
        }
        return new String(out);
    }

    static List<int[]> merge(List<int[]> spans) {
        List<int[]> sorted = new ArrayList<>(spans);
        sorted.sort(Comparator.<int[]>comparingInt(s -> s[0]).thenComparingInt(s -> s[1]));

        List<int[]> merged = new ArrayList<>();
        int[] current = sorted.get(0).clone();
        for (int i = 1; i < sorted.size(); i++) {
            int[] next = sorted.get(i);
            if (next[0] <= current[1]) {
                current[1] = Math.max(current[1], next[1]);
            } else {
                merged.add(current);
                current = next.clone();
            }
        }
        merged.add(current);
        return merged;
    }
}
