package com.deepansh.feed.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Set;

/**
 * Immutable snapshot of one user's personalization signals.
 * degradedSources names the sources that timed out or failed and were
 * replaced by empty values.
 */
public record UserContext(
        String userId,
        Set<String> genres,
        Set<String> friendIds,
        Set<String> seenIds,
        Set<String> savedIds,
        Instant loadedAt,
        Set<String> degradedSources
) {

    public UserContext {
        genres = genres == null ? Set.of() : Set.copyOf(genres);
        friendIds = friendIds == null ? Set.of() : Set.copyOf(friendIds);
        seenIds = seenIds == null ? Set.of() : Set.copyOf(seenIds);
        savedIds = savedIds == null ? Set.of() : Set.copyOf(savedIds);
        degradedSources = degradedSources == null ? Set.of() : Set.copyOf(degradedSources);
    }

    public static UserContext empty(String userId) {
        return new UserContext(userId, Set.of(), Set.of(), Set.of(), Set.of(), Instant.now(), Set.of());
    }

    @JsonIgnore
    public boolean isColdStartGenres() {
        return genres.isEmpty();
    }

    @JsonIgnore
    public boolean isColdStartFriends() {
        return friendIds.isEmpty();
    }

    @JsonIgnore
    public boolean isDegraded() {
        return !degradedSources.isEmpty();
    }
}
