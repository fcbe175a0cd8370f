package com.eidos.core.model;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lower-cased whitespace word sets and their Jaccard similarity.
 */
public final class WordSets {

    private WordSets() {}

    public static Set<String> of(String text) {
        if (text == null) return new HashSet<>();
        String trimmed = text.toLowerCase(Locale.ROOT).trim();
        if (trimmed.isEmpty()) return new HashSet<>();
        return new HashSet<>(Arrays.asList(trimmed.split("\\s+")));
    }

    /** |a ∩ b| / |a ∪ b|, or 0 when either side is empty. */
    public static double jaccard(String a, String b) {
        Set<String> left = of(a);
        Set<String> right = of(b);
        if (left.isEmpty() || right.isEmpty()) return 0.0;
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        Set<String> common = new HashSet<>(left);
        common.retainAll(right);
        return (double) common.size() / union.size();
    }
}
