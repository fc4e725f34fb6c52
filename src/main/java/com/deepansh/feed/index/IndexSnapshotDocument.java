package com.deepansh.feed.index;

import com.deepansh.feed.model.IndexEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One published version of a bucket, written by the external ranking job.
 *
 * Collection: index_snapshots
 */
@Document(collection = "index_snapshots")
@CompoundIndex(name = "idx_bucket_version", def = "{'bucket': 1, 'version': -1}", unique = true)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexSnapshotDocument {

    @Id
    private String id;

    private String bucket;

    private long version;

    private Instant publishedAt;

    @Builder.Default
    private List<IndexEntry> entries = new ArrayList<>();

    public BucketSnapshot toSnapshot() {
        return new BucketSnapshot(bucket, version, publishedAt, entries);
    }
}
