package com.deepansh.feed.context;

import lombok.RequiredArgsConstructor;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Accounts the user follows, from user_follows ({followerId, followeeId}).
 */
@Component
@RequiredArgsConstructor
public class FollowListSource implements UserSignalSource {

    static final String COLLECTION = "user_follows";
    private static final int MAX_FOLLOWS = 5000;

    private final MongoTemplate mongoTemplate;

    @Override
    public String name() {
        return "follows";
    }

    @Override
    public Set<String> fetch(String userId) {
        Query query = new Query(Criteria.where("followerId").is(userId)).limit(MAX_FOLLOWS);
        query.fields().include("followeeId");

        Set<String> followees = new LinkedHashSet<>();
        for (Document document : mongoTemplate.find(query, Document.class, COLLECTION)) {
            String followee = document.getString("followeeId");
            if (followee != null) {
                followees.add(followee);
            }
        }
        return followees;
    }
}
