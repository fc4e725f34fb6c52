package com.deepansh.feed.dedup;

import java.util.Collection;
import java.util.Set;

/**
 * Two-tier record of content already shown.
 *
 * Session tier: exact and TTL-bound. Guarantees no repeat within one session.
 * Account tier: probabilistic and long-lived. Only a ranking signal. A false
 * positive may demote an item but must never make it unreachable.
 *
 * Implementations live in a store shared by all workers and throw
 * DedupStoreUnavailableException when it cannot be reached. There is no
 * process-local fallback.
 */
public interface DedupStore {

    Set<String> sessionSeen(String sessionId);

    void sessionMark(String sessionId, Collection<String> ids);

    boolean accountProbablySeen(String userId, String id);

    /** Subset of ids the account filter reports as probably seen. */
    Set<String> accountProbablySeen(String userId, Collection<String> ids);

    void accountMark(String userId, Collection<String> ids);
}
