package com.deepansh.feed.context;

import com.deepansh.feed.config.FeedProperties;
import com.deepansh.feed.model.UserContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Builds a UserContext from four independent sources fetched concurrently.
 *
 * Each source is bounded by feed.context.source-timeout-ms. A source that
 * times out or fails contributes an empty value and is named in
 * degradedSources; the load itself never fails. Only fully loaded contexts
 * are written to the read-through cache.
 */
@Service
@Slf4j
public class UserContextLoader {

    private final PreferencesSource preferencesSource;
    private final FollowListSource followListSource;
    private final SeenHistorySource seenHistorySource;
    private final SavedItemsSource savedItemsSource;
    private final UserContextCache cache;
    private final Executor executor;
    private final FeedProperties properties;

    public UserContextLoader(PreferencesSource preferencesSource,
                             FollowListSource followListSource,
                             SeenHistorySource seenHistorySource,
                             SavedItemsSource savedItemsSource,
                             UserContextCache cache,
                             @Qualifier("contextTaskExecutor") Executor executor,
                             FeedProperties properties) {
        this.preferencesSource = preferencesSource;
        this.followListSource = followListSource;
        this.seenHistorySource = seenHistorySource;
        this.savedItemsSource = savedItemsSource;
        this.cache = cache;
        this.executor = executor;
        this.properties = properties;
    }

    public UserContext load(String userId) {
        Optional<UserContext> cached = cache.get(userId);
        if (cached.isPresent()) {
            log.debug("User context cache hit [userId={}]", userId);
            return cached.get();
        }

        Set<String> degraded = ConcurrentHashMap.newKeySet();

        CompletableFuture<Set<String>> genres = fetch(preferencesSource, userId, degraded);
        CompletableFuture<Set<String>> friends = fetch(followListSource, userId, degraded);
        CompletableFuture<Set<String>> seen = fetch(seenHistorySource, userId, degraded);
        CompletableFuture<Set<String>> saved = fetch(savedItemsSource, userId, degraded);

        CompletableFuture.allOf(genres, friends, seen, saved).join();

        UserContext context = new UserContext(
                userId,
                genres.join(),
                friends.join(),
                seen.join(),
                saved.join(),
                Instant.now(),
                degraded);

        if (context.isDegraded()) {
            log.warn("User context degraded [userId={}, sources={}]", userId, degraded);
        } else {
            cache.put(context);
        }

        log.debug("User context loaded [userId={}, genres={}, friends={}, seen={}, saved={}]",
                userId, context.genres().size(), context.friendIds().size(),
                context.seenIds().size(), context.savedIds().size());
        return context;
    }

    private CompletableFuture<Set<String>> fetch(UserSignalSource source, String userId, Set<String> degraded) {
        long timeoutMs = properties.getContext().getSourceTimeoutMs();
        return CompletableFuture.supplyAsync(() -> source.fetch(userId), executor)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .exceptionally(ex -> {
                    degraded.add(source.name());
                    log.warn("Context source {} failed for user={}, using empty value: {}",
                            source.name(), userId, ex.toString());
                    return Set.of();
                });
    }
}
