package com.deepansh.feed.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.Set;

/**
 * One ranked candidate inside a bucket snapshot. Scores come from the external
 * ranking job; the engine never recomputes them.
 */
public record IndexEntry(String id, double score, Set<String> tags, Instant updatedAt) {

    /** Score descending, then most recently updated, then id for a total order. */
    public static final Comparator<IndexEntry> RANKING = Comparator
            .comparingDouble(IndexEntry::score).reversed()
            .thenComparing(IndexEntry::updatedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(IndexEntry::id);

    public IndexEntry {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("IndexEntry id must not be blank");
        }
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    public static IndexEntry of(String id, double score) {
        return new IndexEntry(id, score, Set.of(), null);
    }
}
