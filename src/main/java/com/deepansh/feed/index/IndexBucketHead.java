package com.deepansh.feed.index;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Pointer to the latest fully published snapshot of a bucket.
 *
 * Collection: index_bucket_heads
 * The ranking job writes the snapshot document first and flips this pointer
 * last, so a head never references a partially written snapshot.
 */
@Document(collection = "index_bucket_heads")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexBucketHead {

    /** Bucket name */
    @Id
    private String id;

    private long version;

    private Instant publishedAt;
}
