package com.deepansh.feed.model;

import java.util.List;

/**
 * One slice of a plan. nextCursor is null when hasMore is false.
 */
public record FeedPage(List<String> itemIds, int offset, String nextCursor, boolean hasMore) {

    public FeedPage {
        itemIds = itemIds == null ? List.of() : List.copyOf(itemIds);
    }
}
