package com.deepansh.feed.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;

/**
 * Write-once ordered list of item ids for one feed session.
 * planId is the session id; at most one live plan exists per session.
 */
public record FeedPlan(
        String planId,
        String userId,
        List<String> itemIds,
        Instant generatedAt,
        long ttlSeconds,
        long epoch,
        FeedType feedType,
        MixSummary mixSummary
) {

    public FeedPlan {
        itemIds = itemIds == null ? List.of() : List.copyOf(itemIds);
        feedType = feedType == null ? FeedType.FOR_YOU : feedType;
    }

    @JsonIgnore
    public int size() {
        return itemIds.size();
    }

    @JsonIgnore
    public Instant expiresAt() {
        return generatedAt.plusSeconds(ttlSeconds);
    }

    @JsonIgnore
    public boolean isExpired(Instant now) {
        return expiresAt().isBefore(now);
    }
}
