package com.triageplatform.common.aggregation;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Decides whether two hypothesis labels name the same root cause.
 *
 * <p>Labels are trimmed and lower-cased, then match when either one contains the other:
 * <ul>
 *   <li>as a substring ({@code "cache miss"} / {@code "Cache Miss Storm"}), or</li>
 *   <li>word by word, in order ({@code "DB Pool"} / {@code "DB Connection Pool Exhaustion"}).</li>
 * </ul>
 * Both relations are symmetric by construction. A blank label only matches another blank label.
 *
 * <p>The word-order rule goes beyond plain substring containment, which is all the grouping
 * step strictly requires. Substring alone would keep {@code "DB Pool"} and
 * {@code "DB Connection Pool Exhaustion"} apart, because neither string contains the other.
 * The word rule lets such abbreviated labels from different workers corroborate each other.
 */
public final class LabelMatcher {

    private LabelMatcher() {}

    public static boolean matches(String labelA, String labelB) {
        String a = normalize(labelA);
        String b = normalize(labelB);
        if (a.isEmpty() || b.isEmpty()) {
            return a.equals(b);
        }
        if (a.contains(b) || b.contains(a)) {
            return true;
        }
        List<String> wordsA = words(a);
        List<String> wordsB = words(b);
        return containsInOrder(wordsA, wordsB) || containsInOrder(wordsB, wordsA);
    }

    static String normalize(String label) {
        return label == null ? "" : label.strip().toLowerCase(Locale.ROOT);
    }

    private static List<String> words(String normalized) {
        return Arrays.asList(normalized.split("\\s+"));
    }

    /** True if every word of {@code inner} occurs in {@code outer}, preserving order. */
    private static boolean containsInOrder(List<String> outer, List<String> inner) {
        if (inner.size() > outer.size()) {
            return false;
        }
        int next = 0;
        for (String word : outer) {
            if (next < inner.size() && word.equals(inner.get(next))) {
                next++;
            }
        }
        return next == inner.size();
    }
}
