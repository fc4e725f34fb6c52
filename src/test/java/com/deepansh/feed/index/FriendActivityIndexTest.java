package com.deepansh.feed.index;

import com.deepansh.feed.exception.BucketUnavailableException;
import com.deepansh.feed.model.IndexEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FriendActivityIndexTest {

    @Mock MongoTemplate mongoTemplate;

    @InjectMocks
    FriendActivityIndex index;

    @Test
    void rangeTop_returnsRankedPrefix() {
        when(mongoTemplate.findById("u1", FriendActivityDocument.class)).thenReturn(
                new FriendActivityDocument("u1",
                        List.of(IndexEntry.of("f1", 1), IndexEntry.of("f2", 3), IndexEntry.of("f3", 2)),
                        Instant.now()));

        assertThat(index.rangeTop("u1", 2)).extracting(IndexEntry::id).containsExactly("f2", "f3");
    }

    @Test
    void rangeTop_noDocument_throwsBucketUnavailable() {
        when(mongoTemplate.findById("u1", FriendActivityDocument.class)).thenReturn(null);

        assertThatThrownBy(() -> index.rangeTop("u1", 5))
                .isInstanceOf(BucketUnavailableException.class)
                .extracting("bucket").isEqualTo("friends:u1");
    }

    @Test
    void rangeTop_mongoFailure_throwsBucketUnavailable() {
        when(mongoTemplate.findById("u1", FriendActivityDocument.class))
                .thenThrow(new DataAccessResourceFailureException("timeout"));

        assertThatThrownBy(() -> index.rangeTop("u1", 5)).isInstanceOf(BucketUnavailableException.class);
    }
}
