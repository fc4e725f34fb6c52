package com.deepansh.feed.plan;

import com.deepansh.feed.config.FeedProperties;
import com.deepansh.feed.exception.DedupStoreUnavailableException;
import com.deepansh.feed.model.FeedPlan;
import com.deepansh.feed.model.FeedType;
import com.deepansh.feed.model.MixSummary;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisFeedPlanStoreTest {

    @Mock StringRedisTemplate redisTemplate;
    @Mock ValueOperations<String, String> valueOperations;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private RedisFeedPlanStore store;

    @BeforeEach
    void setUp() {
        store = new RedisFeedPlanStore(redisTemplate, objectMapper, new FeedProperties());
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    }

    @Test
    void createIfAbsent_usesSetNxExpiringWithThePlan() {
        FeedPlan plan = plan("s1", Instant.now());
        when(valueOperations.setIfAbsent(eq("feed:plan:s1"), anyString(),
                argThat(ttl -> ttl.compareTo(Duration.ofSeconds(590)) > 0
                        && ttl.compareTo(Duration.ofSeconds(600)) <= 0)))
                .thenReturn(true);

        assertThat(store.createIfAbsent(plan)).isTrue();
    }

    @Test
    void createIfAbsent_planAlreadyExpired_usesMinimalTtl() {
        FeedPlan plan = plan("s1", Instant.now().minusSeconds(3600));
        when(valueOperations.setIfAbsent(eq("feed:plan:s1"), anyString(), eq(Duration.ofMillis(1))))
                .thenReturn(true);

        assertThat(store.createIfAbsent(plan)).isTrue();
    }

    @Test
    void createIfAbsent_keyTaken_returnsFalse() {
        when(valueOperations.setIfAbsent(eq("feed:plan:s1"), anyString(), any(Duration.class)))
                .thenReturn(false);

        assertThat(store.createIfAbsent(plan("s1", Instant.now()))).isFalse();
    }

    @Test
    void find_storedPlan_isReadBack() throws Exception {
        FeedPlan plan = plan("s1");
        when(valueOperations.get("feed:plan:s1")).thenReturn(objectMapper.writeValueAsString(plan));

        assertThat(store.find("s1")).contains(plan);
    }

    @Test
    void find_corruptEntry_isDeletedAndTreatedAsMissing() {
        when(valueOperations.get("feed:plan:s1")).thenReturn("{not json");

        assertThat(store.find("s1")).isEmpty();
        verify(redisTemplate).delete("feed:plan:s1");
    }

    @Test
    void find_redisDown_throwsUnavailable() {
        when(valueOperations.get("feed:plan:s1")).thenThrow(new RedisConnectionFailureException("refused"));

        assertThatThrownBy(() -> store.find("s1")).isInstanceOf(DedupStoreUnavailableException.class);
    }

    @Test
    void lastEpoch_missingKey_isZero() {
        when(valueOperations.get("feed:plan:s1:epoch")).thenReturn(null);

        assertThat(store.lastEpoch("s1")).isZero();
    }

    @Test
    void recordEpoch_writesWithEpochTtl() {
        store.recordEpoch("s1", 4);

        verify(valueOperations).set("feed:plan:s1:epoch", "4", Duration.ofHours(24));
    }

    private FeedPlan plan(String sessionId) {
        return plan(sessionId, Instant.parse("2024-05-01T10:00:00Z"));
    }

    private FeedPlan plan(String sessionId, Instant generatedAt) {
        return new FeedPlan(sessionId, "u1", List.of("a", "b", "c"), generatedAt,
                600, 1, FeedType.FOR_YOU, new MixSummary(Map.of("trending", 2, "personalized", 1, "friends", 0),
                List.of("friends->community"), 0));
    }
}
