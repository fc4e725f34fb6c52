package com.deepansh.feed.context;

import com.deepansh.feed.config.FeedProperties;
import lombok.RequiredArgsConstructor;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Most recently seen item ids from user_seen_items ({userId, itemId, seenAt}).
 */
@Component
@RequiredArgsConstructor
public class SeenHistorySource implements UserSignalSource {

    static final String COLLECTION = "user_seen_items";

    private final MongoTemplate mongoTemplate;
    private final FeedProperties properties;

    @Override
    public String name() {
        return "seen_history";
    }

    @Override
    public Set<String> fetch(String userId) {
        Query query = new Query(Criteria.where("userId").is(userId))
                .with(Sort.by(Sort.Direction.DESC, "seenAt"))
                .limit(properties.getContext().getSeenHistoryLimit());
        query.fields().include("itemId");

        Set<String> seen = new LinkedHashSet<>();
        for (Document document : mongoTemplate.find(query, Document.class, COLLECTION)) {
            String itemId = document.getString("itemId");
            if (itemId != null) {
                seen.add(itemId);
            }
        }
        return seen;
    }
}
