package com.deepansh.feed.dedup;

import com.deepansh.feed.config.FeedProperties;
import com.deepansh.feed.exception.DedupStoreUnavailableException;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Redis-backed dedup store shared by all workers.
 *
 * Key patterns:
 * - feed:session:{sessionId}:seen  SET of emitted ids, TTL feed.dedup.session-ttl
 * - feed:bloom:{userId}            bitmap Bloom filter (see BloomFilterLayout)
 * - feed:bloom:{userId}:count      approximate number of ids added
 *
 * The account filter is reset once its counter passes the configured capacity,
 * which keeps the false-positive rate bounded. Both account keys expire after
 * feed.dedup.bloom-ttl without writes.
 *
 * Membership reads are idempotent and retried (resilience4j "dedupRead").
 * Writes are not retried. Every Redis failure surfaces as
 * DedupStoreUnavailableException.
 */
@Component
@Slf4j
public class RedisDedupStore implements DedupStore {

    private static final String SESSION_PREFIX = "feed:session:";
    private static final String SESSION_SUFFIX = ":seen";
    private static final String BLOOM_PREFIX = "feed:bloom:";
    private static final String COUNT_SUFFIX = ":count";

    private final StringRedisTemplate redisTemplate;
    private final FeedProperties properties;
    private final BloomFilterLayout layout;

    public RedisDedupStore(StringRedisTemplate redisTemplate, FeedProperties properties) {
        this.redisTemplate = redisTemplate;
        this.properties = properties;
        this.layout = BloomFilterLayout.forCapacity(
                properties.getDedup().getBloomCapacity(),
                properties.getDedup().getBloomFalsePositiveRate());
    }

    @Override
    @Retry(name = "dedupRead")
    public Set<String> sessionSeen(String sessionId) {
        try {
            Set<String> members = redisTemplate.opsForSet().members(sessionKey(sessionId));
            return members != null ? members : Set.of();
        } catch (DataAccessException e) {
            throw new DedupStoreUnavailableException("sessionSeen", e);
        }
    }

    @Override
    public void sessionMark(String sessionId, Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return;
        }
        String key = sessionKey(sessionId);
        try {
            redisTemplate.opsForSet().add(key, ids.toArray(new String[0]));
            redisTemplate.expire(key, properties.getDedup().getSessionTtl());
            log.debug("Marked {} ids for session={} (TTL: {})",
                    ids.size(), sessionId, properties.getDedup().getSessionTtl());
        } catch (DataAccessException e) {
            throw new DedupStoreUnavailableException("sessionMark", e);
        }
    }

    @Override
    @Retry(name = "dedupRead")
    public boolean accountProbablySeen(String userId, String id) {
        return probablySeen(userId, List.of(id)).contains(id);
    }

    @Override
    @Retry(name = "dedupRead")
    public Set<String> accountProbablySeen(String userId, Collection<String> ids) {
        return probablySeen(userId, ids);
    }

    @Override
    public void accountMark(String userId, Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return;
        }
        byte[] bloomKey = bloomKey(userId).getBytes(StandardCharsets.UTF_8);
        String countKey = bloomKey(userId) + COUNT_SUFFIX;

        try {
            redisTemplate.executePipelined((RedisCallback<Object>) connection -> {
                for (String id : ids) {
                    for (long offset : layout.offsets(id)) {
                        connection.stringCommands().setBit(bloomKey, offset, true);
                    }
                }
                return null;
            });

            Long count = redisTemplate.opsForValue().increment(countKey, ids.size());
            redisTemplate.expire(bloomKey(userId), properties.getDedup().getBloomTtl());
            redisTemplate.expire(countKey, properties.getDedup().getBloomTtl());

            if (count != null && count > properties.getDedup().getBloomCapacity()) {
                redisTemplate.delete(List.of(bloomKey(userId), countKey));
                log.info("Account filter reset after reaching capacity [userId={}, count={}]", userId, count);
            }
        } catch (DataAccessException e) {
            throw new DedupStoreUnavailableException("accountMark", e);
        }
    }

    private Set<String> probablySeen(String userId, Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return Set.of();
        }
        List<String> ordered = List.copyOf(new LinkedHashSet<>(ids));
        byte[] bloomKey = bloomKey(userId).getBytes(StandardCharsets.UTF_8);

        List<Object> bits;
        try {
            bits = redisTemplate.executePipelined((RedisCallback<Object>) connection -> {
                for (String id : ordered) {
                    for (long offset : layout.offsets(id)) {
                        connection.stringCommands().getBit(bloomKey, offset);
                    }
                }
                return null;
            });
        } catch (DataAccessException e) {
            throw new DedupStoreUnavailableException("accountProbablySeen", e);
        }

        int probes = layout.hashCount();
        if (bits.size() != ordered.size() * probes) {
            throw new IllegalStateException("Expected " + ordered.size() * probes
                    + " bloom probes but Redis returned " + bits.size());
        }

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < ordered.size(); i++) {
            boolean allSet = true;
            for (int j = 0; j < probes; j++) {
                if (!Boolean.TRUE.equals(bits.get(i * probes + j))) {
                    allSet = false;
                    break;
                }
            }
            if (allSet) {
                seen.add(ordered.get(i));
            }
        }
        return seen;
    }

    private String sessionKey(String sessionId) {
        return SESSION_PREFIX + sessionId + SESSION_SUFFIX;
    }

    private String bloomKey(String userId) {
        return BLOOM_PREFIX + userId;
    }
}
