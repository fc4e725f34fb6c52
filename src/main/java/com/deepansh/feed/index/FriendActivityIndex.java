package com.deepansh.feed.index;

import com.deepansh.feed.exception.BucketUnavailableException;
import com.deepansh.feed.model.IndexEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reads the precomputed friends:{userId} bucket. One document read per
 * request regardless of how many accounts the user follows.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FriendActivityIndex {

    public static final String BUCKET_PREFIX = "friends:";

    private final MongoTemplate mongoTemplate;

    public List<IndexEntry> rangeTop(String userId, int n) {
        String bucket = BUCKET_PREFIX + userId;
        FriendActivityDocument document;
        try {
            document = mongoTemplate.findById(userId, FriendActivityDocument.class);
        } catch (DataAccessException e) {
            log.warn("Friend activity read failed [userId={}]: {}", userId, e.getMessage());
            throw new BucketUnavailableException(bucket);
        }

        if (document == null) {
            throw new BucketUnavailableException(bucket);
        }

        return document.getEntries().stream()
                .sorted(IndexEntry.RANKING)
                .limit(Math.max(0, n))
                .toList();
    }
}
