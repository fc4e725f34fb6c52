package com.deepansh.feed.dedup;

import com.deepansh.feed.config.FeedProperties;
import com.deepansh.feed.exception.DedupStoreUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisDedupStoreTest {

    @Mock StringRedisTemplate redisTemplate;
    @Mock SetOperations<String, String> setOperations;
    @Mock ValueOperations<String, String> valueOperations;

    private FeedProperties properties;
    private RedisDedupStore store;

    @BeforeEach
    void setUp() {
        properties = new FeedProperties();
        properties.getDedup().setBloomCapacity(100);
        store = new RedisDedupStore(redisTemplate, properties);
    }

    @Test
    void sessionSeen_returnsMembers() {
        when(redisTemplate.opsForSet()).thenReturn(setOperations);
        when(setOperations.members("feed:session:s1:seen")).thenReturn(Set.of("a", "b"));

        assertThat(store.sessionSeen("s1")).containsExactlyInAnyOrder("a", "b");
    }

    @Test
    void sessionSeen_redisDown_throwsUnavailable() {
        when(redisTemplate.opsForSet()).thenReturn(setOperations);
        when(setOperations.members("feed:session:s1:seen"))
                .thenThrow(new RedisConnectionFailureException("refused"));

        assertThatThrownBy(() -> store.sessionSeen("s1"))
                .isInstanceOf(DedupStoreUnavailableException.class)
                .hasFieldOrPropertyWithValue("retryable", true);
    }

    @Test
    void sessionMark_addsIdsAndRefreshesTtl() {
        when(redisTemplate.opsForSet()).thenReturn(setOperations);

        store.sessionMark("s1", List.of("a", "b"));

        verify(setOperations).add("feed:session:s1:seen", "a", "b");
        verify(redisTemplate).expire("feed:session:s1:seen", Duration.ofMinutes(10));
    }

    @Test
    void accountProbablySeen_allProbesSet_reportsSeen() {
        BloomFilterLayout layout = BloomFilterLayout.forCapacity(100, 0.01);
        int k = layout.hashCount();
        List<Object> bits = new ArrayList<>();
        // "a": every probe set, "b": last probe clear
        for (int i = 0; i < k; i++) bits.add(Boolean.TRUE);
        for (int i = 0; i < k; i++) bits.add(i < k - 1);
        when(redisTemplate.executePipelined(any(RedisCallback.class))).thenReturn(bits);

        Set<String> seen = store.accountProbablySeen("u1", List.of("a", "b"));

        assertThat(seen).containsExactly("a");
    }

    @Test
    void accountProbablySeen_emptyInput_skipsRedis() {
        assertThat(store.accountProbablySeen("u1", List.of())).isEmpty();
        verify(redisTemplate, never()).executePipelined(any(RedisCallback.class));
    }

    @Test
    void accountMark_belowCapacity_keepsFilter() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.increment("feed:bloom:u1:count", 2L)).thenReturn(50L);

        store.accountMark("u1", List.of("a", "b"));

        verify(redisTemplate).executePipelined(any(RedisCallback.class));
        verify(redisTemplate).expire("feed:bloom:u1", Duration.ofDays(30));
        verify(redisTemplate, never()).delete(anyCollection());
    }

    @Test
    void accountMark_pastCapacity_resetsFilter() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.increment("feed:bloom:u1:count", 1L)).thenReturn(101L);

        store.accountMark("u1", List.of("a"));

        verify(redisTemplate).delete(List.of("feed:bloom:u1", "feed:bloom:u1:count"));
    }
}
