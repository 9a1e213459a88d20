package com.priceintel.harvester.resolver;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Token-set (Jaccard) similarity of normalized product titles.
 */
public final class TitleSimilarity {

    private TitleSimilarity() {
    }

    public static String normalize(String title) {
        if (title == null) return "";
        return title.toLowerCase(Locale.ROOT)
                .replaceAll("[^\\w\\s]", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }

    public static Set<String> tokens(String title) {
        String normalized = normalize(title);
        if (normalized.isEmpty()) return Set.of();
        return Arrays.stream(normalized.split(" "))
                .filter(t -> t.length() > 1)
                .collect(Collectors.toSet());
    }

    /** 0.0 when either title has no tokens, 1.0 for identical token sets. */
    public static double score(String a, String b) {
        Set<String> left = tokens(a);
        Set<String> right = tokens(b);
        if (left.isEmpty() || right.isEmpty()) return 0.0;

        Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        return (double) intersection.size() / union.size();
    }
}
