package com.deepansh.feed.exception;

import lombok.Getter;

/**
 * The plan referenced by a cursor has expired. The client restarts from the
 * first page, which creates a new plan.
 */
@Getter
public class ExpiredSessionException extends FeedException {

    private final String sessionId;

    public ExpiredSessionException(String sessionId) {
        super("EXPIRED_SESSION", false, "Feed session expired: " + sessionId);
        this.sessionId = sessionId;
    }
}
