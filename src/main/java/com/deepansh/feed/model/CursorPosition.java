package com.deepansh.feed.model;

public record CursorPosition(String sessionId, int offset) {
}
