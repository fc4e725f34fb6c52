package com.deepansh.feed.model;

import java.util.List;
import java.util.Map;

/**
 * How a plan was filled: items taken per bucket, cold-start or fallback
 * substitutions applied, and items appended by the trending top-up.
 */
public record MixSummary(Map<String, Integer> counts, List<String> substitutions, int toppedUp) {

    public MixSummary {
        counts = counts == null ? Map.of() : Map.copyOf(counts);
        substitutions = substitutions == null ? List.of() : List.copyOf(substitutions);
    }
}
