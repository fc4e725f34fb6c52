package com.deepansh.feed.exception;

import lombok.Getter;

/**
 * A candidate bucket was never populated and has no fallback.
 * Absorbed by the plan generator: the bucket contributes zero items.
 */
@Getter
public class BucketUnavailableException extends FeedException {

    private final String bucket;

    public BucketUnavailableException(String bucket) {
        super("BUCKET_UNAVAILABLE", true, "Candidate bucket unavailable: " + bucket);
        this.bucket = bucket;
    }
}
