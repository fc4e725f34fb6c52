package com.deepansh.feed.observability;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface FeedEventRepository extends MongoRepository<FeedEventDocument, String> {
}
