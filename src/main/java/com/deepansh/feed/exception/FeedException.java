package com.deepansh.feed.exception;

import lombok.Getter;

/**
 * Base type for failures the feed engine reports to its caller.
 * Carries a stable error code and whether the client may simply retry.
 */
@Getter
public abstract class FeedException extends RuntimeException {

    private final String code;
    private final boolean retryable;

    protected FeedException(String code, boolean retryable, String message) {
        super(message);
        this.code = code;
        this.retryable = retryable;
    }

    protected FeedException(String code, boolean retryable, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.retryable = retryable;
    }
}
