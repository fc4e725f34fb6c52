package com.deepansh.feed.exception;

/**
 * The shared session store (dedup sets, plans) could not be reached.
 * Plan creation must fail rather than fall back to process-local state.
 */
public class DedupStoreUnavailableException extends FeedException {

    public DedupStoreUnavailableException(String operation, Throwable cause) {
        super("DEDUP_STORE_UNAVAILABLE", true,
                "Session store unavailable during " + operation, cause);
    }
}
