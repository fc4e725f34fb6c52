package com.deepansh.feed.plan;

import com.deepansh.feed.model.FeedPlan;

import java.util.Optional;

/**
 * Shared, write-once storage for feed plans keyed by session id.
 */
public interface FeedPlanStore {

    /** The live plan for a session, empty if none exists or it expired. */
    Optional<FeedPlan> find(String sessionId);

    /**
     * Stores the plan only if the session has no live plan.
     * Returns false if another writer got there first.
     */
    boolean createIfAbsent(FeedPlan plan);

    /** Epoch of the last plan created for the session, 0 if none. */
    long lastEpoch(String sessionId);

    void recordEpoch(String sessionId, long epoch);
}
