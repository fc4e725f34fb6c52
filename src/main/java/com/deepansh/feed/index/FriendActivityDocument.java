package com.deepansh.feed.index;

import com.deepansh.feed.model.IndexEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-user friend activity, fanned out on write by the ingestion pipeline.
 *
 * Collection: friend_activity_index
 */
@Document(collection = "friend_activity_index")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FriendActivityDocument {

    /** Owner user id */
    @Id
    private String id;

    @Builder.Default
    private List<IndexEntry> entries = new ArrayList<>();

    private Instant updatedAt;
}
