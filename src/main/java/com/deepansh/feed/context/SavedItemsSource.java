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
 * Favourites and watchlist entries from user_saved_items ({userId, itemId, savedAt}).
 */
@Component
@RequiredArgsConstructor
public class SavedItemsSource implements UserSignalSource {

    static final String COLLECTION = "user_saved_items";

    private final MongoTemplate mongoTemplate;
    private final FeedProperties properties;

    @Override
    public String name() {
        return "saved_items";
    }

    @Override
    public Set<String> fetch(String userId) {
        Query query = new Query(Criteria.where("userId").is(userId))
                .with(Sort.by(Sort.Direction.DESC, "savedAt"))
                .limit(properties.getContext().getSavedItemsLimit());
        query.fields().include("itemId");

        Set<String> saved = new LinkedHashSet<>();
        for (Document document : mongoTemplate.find(query, Document.class, COLLECTION)) {
            String itemId = document.getString("itemId");
            if (itemId != null) {
                saved.add(itemId);
            }
        }
        return saved;
    }
}
