package com.deepansh.feed.index;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Pulls newly published bucket versions into the in-process index pool.
 *
 * Each worker runs its own refresher. Snapshots are read-only and versioned,
 * so workers converge on the same data without coordination. A failed
 * refresh keeps the previous snapshot in service; a bucket whose snapshot
 * cannot be loaded or mapped is skipped until its next version.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IndexSnapshotRefresher {

    private final MongoTemplate mongoTemplate;
    private final CandidateIndexPool indexPool;

    @Scheduled(fixedDelayString = "${feed.index.refresh-interval-ms:30000}", initialDelay = 0)
    public void refresh() {
        List<IndexBucketHead> heads;
        try {
            heads = mongoTemplate.findAll(IndexBucketHead.class);
        } catch (DataAccessException e) {
            log.error("Index refresh skipped, bucket heads unreadable: {}", e.getMessage());
            return;
        }

        int published = 0;
        for (IndexBucketHead head : heads) {
            if (head.getVersion() <= indexPool.version(head.getId())) {
                continue;
            }
            try {
                if (refreshBucket(head)) {
                    published++;
                }
            } catch (RuntimeException e) {
                // One unreadable snapshot must not starve the buckets after it
                log.error("Failed to load snapshot [bucket={}, version={}]", head.getId(), head.getVersion(), e);
            }
        }

        if (published > 0) {
            log.info("Index refresh complete [heads={}, published={}]", heads.size(), published);
        }
    }

    private boolean refreshBucket(IndexBucketHead head) {
        Query query = new Query(Criteria.where("bucket").is(head.getId())
                .and("version").is(head.getVersion()));
        IndexSnapshotDocument document = mongoTemplate.findOne(query, IndexSnapshotDocument.class);

        if (document == null) {
            log.warn("Bucket head points at missing snapshot [bucket={}, version={}]",
                    head.getId(), head.getVersion());
            return false;
        }
        return indexPool.publish(document.toSnapshot());
    }
}
