package com.deepansh.feed.index;

import com.deepansh.feed.model.IndexEntry;

import java.time.Instant;
import java.util.List;

/**
 * Immutable, fully published version of one bucket. Entries are kept in
 * ranking order so a top-n read is a prefix view.
 */
public record BucketSnapshot(String bucket, long version, Instant publishedAt, List<IndexEntry> entries) {

    public BucketSnapshot {
        entries = entries == null ? List.of() : entries.stream().sorted(IndexEntry.RANKING).toList();
    }

    public List<IndexEntry> top(int n) {
        if (n <= 0) return List.of();
        return entries.subList(0, Math.min(n, entries.size()));
    }

    public int size() {
        return entries.size();
    }
}
