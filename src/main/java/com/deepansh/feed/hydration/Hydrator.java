package com.deepansh.feed.hydration;

import com.deepansh.feed.config.FeedProperties;
import com.deepansh.feed.model.ContentMetadata;
import com.deepansh.feed.model.FeedItem;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Resolves planned ids to display metadata.
 *
 * Key pattern: feed:meta:{id}, JSON of ContentMetadata, TTL feed.hydration.cache-ttl.
 * Entries are never invalidated explicitly; they age out.
 *
 * One MGET for the whole page, one backend batch call for the misses, then
 * one pipelined SETEX round trip caching what the backend returned.
 * A cache outage degrades to backend-only lookups.
 */
@Component
@Slf4j
public class Hydrator {

    private static final String KEY_PREFIX = "feed:meta:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final MetadataBackend backend;
    private final FeedProperties properties;

    public Hydrator(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                    MetadataBackend backend, FeedProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.backend = backend;
        this.properties = properties;
    }

    public HydrationResult hydrate(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return new HydrationResult(List.of(), List.of());
        }

        List<String> distinct = List.copyOf(new LinkedHashSet<>(ids));
        Map<String, ContentMetadata> resolved = new HashMap<>(readCache(distinct));

        List<String> misses = distinct.stream()
                .filter(id -> !resolved.containsKey(id))
                .toList();

        if (!misses.isEmpty()) {
            Map<String, ContentMetadata> fetched = backend.batchLookup(misses);
            resolved.putAll(fetched);
            writeCache(fetched);
            log.debug("Hydration [requested={}, cacheHits={}, backendResolved={}]",
                    distinct.size(), distinct.size() - misses.size(), fetched.size());
        }

        List<FeedItem> items = new ArrayList<>(ids.size());
        List<String> unresolved = new ArrayList<>();
        for (String id : ids) {
            ContentMetadata metadata = resolved.get(id);
            if (metadata != null) {
                items.add(FeedItem.from(metadata));
            } else {
                unresolved.add(id);
            }
        }

        if (!unresolved.isEmpty()) {
            log.warn("Partial hydration: {} of {} ids unresolved {}", unresolved.size(), ids.size(), unresolved);
        }
        return new HydrationResult(items, unresolved);
    }

    private Map<String, ContentMetadata> readCache(List<String> ids) {
        List<String> values;
        try {
            values = redisTemplate.opsForValue().multiGet(ids.stream().map(this::buildKey).toList());
        } catch (DataAccessException e) {
            log.warn("Metadata cache read failed, going to backend for {} ids: {}", ids.size(), e.getMessage());
            return Map.of();
        }
        if (values == null) {
            return Map.of();
        }

        Map<String, ContentMetadata> hits = new HashMap<>();
        for (int i = 0; i < ids.size() && i < values.size(); i++) {
            String json = values.get(i);
            if (json == null) continue;
            try {
                hits.put(ids.get(i), objectMapper.readValue(json, ContentMetadata.class));
            } catch (JsonProcessingException e) {
                log.warn("Ignoring unreadable cached metadata for id={}", ids.get(i));
            }
        }
        return hits;
    }

    private void writeCache(Map<String, ContentMetadata> fetched) {
        Map<byte[], byte[]> entries = new LinkedHashMap<>();
        for (Map.Entry<String, ContentMetadata> entry : fetched.entrySet()) {
            try {
                entries.put(buildKey(entry.getKey()).getBytes(StandardCharsets.UTF_8),
                        objectMapper.writeValueAsBytes(entry.getValue()));
            } catch (JsonProcessingException e) {
                log.error("Failed to serialize metadata for id={}", entry.getKey(), e);
            }
        }
        if (entries.isEmpty()) {
            return;
        }

        long ttlSeconds = properties.getHydration().getCacheTtl().toSeconds();
        try {
            redisTemplate.executePipelined((RedisCallback<Object>) connection -> {
                entries.forEach((key, value) -> connection.stringCommands().setEx(key, ttlSeconds, value));
                return null;
            });
        } catch (DataAccessException e) {
            log.warn("Metadata cache write failed for {} ids: {}", entries.size(), e.getMessage());
        }
    }

    private String buildKey(String id) {
        return KEY_PREFIX + id;
    }
}
