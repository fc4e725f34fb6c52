package com.deepansh.feed.context;

import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PreferencesSourceTest {

    @Mock MongoTemplate mongoTemplate;

    @InjectMocks
    PreferencesSource source;

    @Test
    void fetch_normalisesGenreNamesToBucketKeys() {
        when(mongoTemplate.findOne(any(Query.class), eq(Document.class), eq(PreferencesSource.COLLECTION)))
                .thenReturn(new Document("selectedGenres", List.of("Sci Fi", " Drama ", "")));

        assertThat(source.fetch("u1")).containsExactly("sci_fi", "drama");
    }

    @Test
    void fetch_noPreferences_returnsEmpty() {
        when(mongoTemplate.findOne(any(Query.class), eq(Document.class), eq(PreferencesSource.COLLECTION)))
                .thenReturn(null);

        assertThat(source.fetch("u1")).isEmpty();
    }
}
