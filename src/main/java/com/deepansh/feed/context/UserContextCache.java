package com.deepansh.feed.context;

import com.deepansh.feed.config.FeedProperties;
import com.deepansh.feed.model.UserContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Short-lived read-through cache for user contexts.
 *
 * - Key pattern: feed:context:{userId}
 * - Stored as a single JSON document with a fixed TTL (feed.context.cache-ttl)
 * - Best effort: a Redis failure is a cache miss, never a request failure
 */
@Component
@Slf4j
public class UserContextCache {

    private static final String KEY_PREFIX = "feed:context:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final FeedProperties properties;

    public UserContextCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, FeedProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public Optional<UserContext> get(String userId) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(buildKey(userId));
        } catch (DataAccessException e) {
            log.warn("Context cache read failed for user={}: {}", userId, e.getMessage());
            return Optional.empty();
        }

        if (json == null) {
            return Optional.empty();
        }

        try {
            return Optional.of(objectMapper.readValue(json, UserContext.class));
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize cached context for user={}. Ignoring entry.", userId, e);
            return Optional.empty();
        }
    }

    public void put(UserContext context) {
        try {
            String json = objectMapper.writeValueAsString(context);
            redisTemplate.opsForValue().set(buildKey(context.userId()), json, properties.getContext().getCacheTtl());
            log.debug("Cached context for user={} (TTL: {})", context.userId(), properties.getContext().getCacheTtl());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize context for user={}", context.userId(), e);
        } catch (DataAccessException e) {
            log.warn("Context cache write failed for user={}: {}", context.userId(), e.getMessage());
        }
    }

    private String buildKey(String userId) {
        return KEY_PREFIX + userId;
    }
}
