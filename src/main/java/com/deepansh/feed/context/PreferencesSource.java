package com.deepansh.feed.context;

import lombok.RequiredArgsConstructor;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Selected genres from user_preferences ({_id: userId, selectedGenres: [...]}).
 * Genres are normalised to the bucket naming used by the index ("sci fi" -> "sci_fi").
 */
@Component
@RequiredArgsConstructor
public class PreferencesSource implements UserSignalSource {

    static final String COLLECTION = "user_preferences";

    private final MongoTemplate mongoTemplate;

    @Override
    public String name() {
        return "preferences";
    }

    @Override
    public Set<String> fetch(String userId) {
        Query query = new Query(Criteria.where("_id").is(userId));
        query.fields().include("selectedGenres");
        Document document = mongoTemplate.findOne(query, Document.class, COLLECTION);
        if (document == null) {
            return Set.of();
        }

        List<String> genres = document.getList("selectedGenres", String.class, List.of());
        Set<String> normalised = new LinkedHashSet<>();
        for (String genre : genres) {
            if (genre != null && !genre.isBlank()) {
                normalised.add(genre.trim().toLowerCase(Locale.ROOT).replace(' ', '_'));
            }
        }
        return normalised;
    }
}
