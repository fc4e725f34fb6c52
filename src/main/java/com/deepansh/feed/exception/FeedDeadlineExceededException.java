package com.deepansh.feed.exception;

public class FeedDeadlineExceededException extends FeedException {

    public FeedDeadlineExceededException(long deadlineMs) {
        super("DEADLINE_EXCEEDED", true, "Feed assembly exceeded its " + deadlineMs + "ms deadline");
    }
}
