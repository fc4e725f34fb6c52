package com.deepansh.feed.model;

import com.deepansh.feed.config.FeedProperties;

/**
 * Mixing partitions of a plan, in the order they are concatenated.
 */
public enum CandidateBucket {

    TRENDING("trending"),
    PERSONALIZED("personalized"),
    FRIENDS("friends");

    private final String key;

    CandidateBucket(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public double share(FeedProperties.Mix mix) {
        return switch (this) {
            case TRENDING -> mix.getTrendingShare();
            case PERSONALIZED -> mix.getPersonalizedShare();
            case FRIENDS -> mix.getFriendsShare();
        };
    }
}
