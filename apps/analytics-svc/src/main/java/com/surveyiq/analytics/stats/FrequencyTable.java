package com.surveyiq.analytics.stats;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Insertion-ordered occurrence counter. Ranking is a stable sort, so equal counts keep the order
 * in which their keys were first seen.
 */
final class FrequencyTable {

    record Tally(String key, int count, int percentage) {
    }

    private final Map<String, Integer> counts = new LinkedHashMap<>();

    void add(String key) {
        if (key != null) {
            counts.merge(key, 1, Integer::sum);
        }
    }

    void addAll(Collection<String> keys) {
        keys.forEach(this::add);
    }

    int count(String key) {
        return counts.getOrDefault(key, 0);
    }

    boolean isEmpty() {
        return counts.isEmpty();
    }

    List<Tally> ranked(int denominator) {
        return ranked(denominator, Integer.MAX_VALUE);
    }

    List<Tally> ranked(int denominator, int limit) {
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(limit)
                .map(entry -> new Tally(entry.getKey(), entry.getValue(), Percentages.of(entry.getValue(), denominator)))
                .toList();
    }
}
