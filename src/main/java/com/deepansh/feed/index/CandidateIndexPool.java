package com.deepansh.feed.index;

import com.deepansh.feed.config.FeedProperties;
import com.deepansh.feed.exception.BucketUnavailableException;
import com.deepansh.feed.model.IndexEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-process view of the shared candidate buckets (trending, genre:*, community).
 *
 * Readers see a map of immutable snapshots held in an AtomicReference.
 * A publish builds a new map and swaps it in, so a reader never observes a
 * partially written bucket and never blocks a writer.
 *
 * Bucket names are "family:qualifier" or just "family". A bucket that was never
 * published falls back to the bucket configured for its family
 * (feed.index.fallbacks), otherwise the read fails with BucketUnavailableException.
 */
@Component
@Slf4j
public class CandidateIndexPool {

    private final AtomicReference<Map<String, BucketSnapshot>> snapshots = new AtomicReference<>(Map.of());
    private final FeedProperties properties;

    public CandidateIndexPool(FeedProperties properties) {
        this.properties = properties;
    }

    /**
     * Top n entries of a bucket by score, ties by most recent update then id.
     */
    public List<IndexEntry> rangeTop(String bucket, int n) {
        BucketSnapshot snapshot = snapshots.get().get(bucket);
        if (snapshot != null) {
            return snapshot.top(n);
        }

        Optional<String> fallback = fallbackFor(bucket);
        if (fallback.isPresent()) {
            BucketSnapshot fallbackSnapshot = snapshots.get().get(fallback.get());
            if (fallbackSnapshot != null) {
                log.info("Bucket {} not populated, reading fallback {}", bucket, fallback.get());
                return fallbackSnapshot.top(n);
            }
        }

        log.warn("Bucket {} unavailable and no populated fallback", bucket);
        throw new BucketUnavailableException(bucket);
    }

    /** Whether the bucket was ever published. An empty bucket still exists. */
    public boolean exists(String bucket) {
        return snapshots.get().containsKey(bucket);
    }

    /** Version currently served for a bucket, or -1 if never published. */
    public long version(String bucket) {
        BucketSnapshot snapshot = snapshots.get().get(bucket);
        return snapshot != null ? snapshot.version() : -1L;
    }

    public int bucketCount() {
        return snapshots.get().size();
    }

    /**
     * Fallback bucket for a bucket family, never the bucket itself.
     */
    public Optional<String> fallbackFor(String bucket) {
        String family = bucket.contains(":") ? bucket.substring(0, bucket.indexOf(':')) : bucket;
        String fallback = properties.getIndex().getFallbacks().get(family);
        if (fallback == null || fallback.equals(bucket)) {
            return Optional.empty();
        }
        return Optional.of(fallback);
    }

    /**
     * Atomically replaces a bucket. Snapshots not newer than the served version
     * are ignored. Returns true if the snapshot was swapped in.
     */
    public boolean publish(BucketSnapshot snapshot) {
        boolean[] swapped = {false};
        snapshots.updateAndGet(current -> {
            BucketSnapshot existing = current.get(snapshot.bucket());
            if (existing != null && existing.version() >= snapshot.version()) {
                swapped[0] = false;
                return current;
            }
            Map<String, BucketSnapshot> next = new HashMap<>(current);
            next.put(snapshot.bucket(), snapshot);
            swapped[0] = true;
            return Map.copyOf(next);
        });

        if (swapped[0]) {
            log.info("Published bucket snapshot [bucket={}, version={}, entries={}]",
                    snapshot.bucket(), snapshot.version(), snapshot.size());
        } else {
            log.debug("Ignored stale snapshot [bucket={}, version={}]", snapshot.bucket(), snapshot.version());
        }
        return swapped[0];
    }
}
