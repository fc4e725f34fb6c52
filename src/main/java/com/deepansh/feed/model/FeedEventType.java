package com.deepansh.feed.model;

public enum FeedEventType {
    SHOWN,
    VIEW,
    LIKE,
    SHARE,
    SKIP,
    COMPLETE,
    SAVE
}
