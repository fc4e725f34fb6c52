package com.deepansh.feed.observability;

import com.deepansh.feed.model.FeedEventType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One analytics event in MongoDB.
 *
 * SHOWN events are written by the engine for every page served. The other
 * types arrive from clients through the events endpoint. Downstream analytics
 * jobs read this collection; the engine never queries it on the request path.
 */
@Document(collection = "feed_events")
@CompoundIndexes({
    @CompoundIndex(name = "idx_event_user_time", def = "{'userId': 1, 'occurredAt': -1}"),
    @CompoundIndex(name = "idx_event_session", def = "{'sessionId': 1, 'occurredAt': 1}")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedEventDocument {

    @Id
    private String id;

    private String userId;
    private String sessionId;

    @Indexed
    private String itemId;

    private FeedEventType type;

    /** Position in the plan; SHOWN events only */
    private Integer position;

    private Integer durationWatchedSec;
    private Instant occurredAt;

    @CreatedDate
    private Instant createdAt;
}
