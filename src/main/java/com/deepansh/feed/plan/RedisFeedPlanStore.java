package com.deepansh.feed.plan;

import com.deepansh.feed.config.FeedProperties;
import com.deepansh.feed.exception.DedupStoreUnavailableException;
import com.deepansh.feed.model.FeedPlan;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Redis-backed plan store.
 *
 * Key patterns:
 * - feed:plan:{sessionId}        plan JSON, expiring at generatedAt + plan ttl
 * - feed:plan:{sessionId}:epoch  last generation epoch, TTL feed.plan.epoch-ttl
 *
 * Creation uses SET NX with TTL, so concurrent first requests on different
 * workers elect exactly one writer; the others read the winner's plan back.
 */
@Component
@Slf4j
public class RedisFeedPlanStore implements FeedPlanStore {

    private static final String KEY_PREFIX = "feed:plan:";
    private static final String EPOCH_SUFFIX = ":epoch";
    private static final Duration MIN_TTL = Duration.ofMillis(1);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final FeedProperties properties;

    public RedisFeedPlanStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, FeedProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public Optional<FeedPlan> find(String sessionId) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(buildKey(sessionId));
        } catch (DataAccessException e) {
            throw new DedupStoreUnavailableException("findPlan", e);
        }

        if (json == null) {
            return Optional.empty();
        }

        try {
            return Optional.of(objectMapper.readValue(json, FeedPlan.class));
        } catch (JsonProcessingException e) {
            // An unreadable plan would block SET NX until it expires, so drop it
            log.error("Corrupt plan for session={}, deleting so it can be regenerated", sessionId, e);
            redisTemplate.delete(buildKey(sessionId));
            return Optional.empty();
        }
    }

    @Override
    public boolean createIfAbsent(FeedPlan plan) {
        String json;
        try {
            json = objectMapper.writeValueAsString(plan);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize plan for session " + plan.planId(), e);
        }

        // Key expires when the plan does
        Duration ttl = Duration.between(Instant.now(), plan.expiresAt());
        if (ttl.compareTo(MIN_TTL) < 0) {
            ttl = MIN_TTL;
        }

        try {
            Boolean created = redisTemplate.opsForValue()
                    .setIfAbsent(buildKey(plan.planId()), json, ttl);
            return Boolean.TRUE.equals(created);
        } catch (DataAccessException e) {
            throw new DedupStoreUnavailableException("createPlan", e);
        }
    }

    @Override
    public long lastEpoch(String sessionId) {
        try {
            String value = redisTemplate.opsForValue().get(buildKey(sessionId) + EPOCH_SUFFIX);
            return value != null ? Long.parseLong(value) : 0L;
        } catch (DataAccessException e) {
            throw new DedupStoreUnavailableException("readEpoch", e);
        } catch (NumberFormatException e) {
            log.warn("Unreadable epoch for session={}, restarting at 0", sessionId);
            return 0L;
        }
    }

    @Override
    public void recordEpoch(String sessionId, long epoch) {
        try {
            redisTemplate.opsForValue().set(buildKey(sessionId) + EPOCH_SUFFIX,
                    Long.toString(epoch), properties.getPlan().getEpochTtl());
        } catch (DataAccessException e) {
            throw new DedupStoreUnavailableException("recordEpoch", e);
        }
    }

    private String buildKey(String sessionId) {
        return KEY_PREFIX + sessionId;
    }
}
