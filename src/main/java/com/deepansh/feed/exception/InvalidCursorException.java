package com.deepansh.feed.exception;

public class InvalidCursorException extends FeedException {

    public InvalidCursorException(String reason) {
        super("INVALID_CURSOR", false, "Invalid cursor: " + reason);
    }
}
