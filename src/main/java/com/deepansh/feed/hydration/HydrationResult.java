package com.deepansh.feed.hydration;

import com.deepansh.feed.model.FeedItem;

import java.util.List;

/**
 * Items in request order plus the ids that could not be resolved.
 */
public record HydrationResult(List<FeedItem> items, List<String> unresolvedIds) {

    public HydrationResult {
        items = items == null ? List.of() : List.copyOf(items);
        unresolvedIds = unresolvedIds == null ? List.of() : List.copyOf(unresolvedIds);
    }

    public boolean isPartial() {
        return !unresolvedIds.isEmpty();
    }
}
