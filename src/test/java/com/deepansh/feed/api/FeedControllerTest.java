package com.deepansh.feed.api;

import com.deepansh.feed.core.FeedService;
import com.deepansh.feed.exception.CandidatesUnavailableException;
import com.deepansh.feed.exception.ExpiredSessionException;
import com.deepansh.feed.exception.InvalidCursorException;
import com.deepansh.feed.index.CandidateIndexPool;
import com.deepansh.feed.model.FeedEventBatch;
import com.deepansh.feed.model.FeedItem;
import com.deepansh.feed.model.FeedMeta;
import com.deepansh.feed.model.FeedResponse;
import com.deepansh.feed.model.FeedType;
import com.deepansh.feed.observability.FeedEventPublisher;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(FeedController.class)
class FeedControllerTest {

    @Autowired MockMvc mockMvc;

    @MockBean FeedService feedService;
    @MockBean FeedEventPublisher eventPublisher;
    @MockBean CandidateIndexPool indexPool;

    @Test
    void getFeed_returnsPage() throws Exception {
        when(feedService.getFeed("u1", null, 10, FeedType.FOR_YOU)).thenReturn(FeedResponse.builder()
                .items(List.of(FeedItem.builder().id("m1").title("Heat").build()))
                .nextCursor("next")
                .hasMore(true)
                .meta(FeedMeta.builder().sessionId("s1").planSize(50).build())
                .build());

        mockMvc.perform(get("/api/v1/feed").header("X-User-Id", "u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].id").value("m1"))
                .andExpect(jsonPath("$.nextCursor").value("next"))
                .andExpect(jsonPath("$.hasMore").value(true))
                .andExpect(jsonPath("$.meta.sessionId").value("s1"));
    }

    @Test
    void getFeed_missingUserHeader_isBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/feed"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MISSING_HEADER"));
        verifyNoInteractions(feedService);
    }

    @Test
    void getFeed_limitOutOfRange_isBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/feed").header("X-User-Id", "u1").param("limit", "0"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/v1/feed").header("X-User-Id", "u1").param("limit", "101"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void getFeed_trendingFeedType_isPassedThrough() throws Exception {
        when(feedService.getFeed("u1", null, 10, FeedType.TRENDING)).thenReturn(FeedResponse.builder()
                .items(List.of())
                .hasMore(true)
                .meta(FeedMeta.builder().sessionId("s1").feedType(FeedType.TRENDING).build())
                .build());

        mockMvc.perform(get("/api/v1/feed").header("X-User-Id", "u1").param("feedType", "trending"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.meta.feedType").value("trending"));
    }

    @Test
    void getFeed_unknownFeedType_isBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/feed").header("X-User-Id", "u1").param("feedType", "following"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
        verifyNoInteractions(feedService);
    }

    @Test
    void getFeed_invalidCursor_is400() throws Exception {
        when(feedService.getFeed("u1", "bad", 10, FeedType.FOR_YOU))
                .thenThrow(new InvalidCursorException("malformed"));

        mockMvc.perform(get("/api/v1/feed").header("X-User-Id", "u1").param("cursor", "bad"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_CURSOR"))
                .andExpect(jsonPath("$.retryable").value(false));
    }

    @Test
    void getFeed_expiredSession_is410() throws Exception {
        when(feedService.getFeed("u1", "old", 10, FeedType.FOR_YOU)).thenThrow(new ExpiredSessionException("s1"));

        mockMvc.perform(get("/api/v1/feed").header("X-User-Id", "u1").param("cursor", "old"))
                .andExpect(status().isGone())
                .andExpect(jsonPath("$.code").value("EXPIRED_SESSION"));
    }

    @Test
    void getFeed_retryableFailure_is503WithRetryAfter() throws Exception {
        when(feedService.getFeed("u1", null, 10, FeedType.FOR_YOU))
                .thenThrow(new CandidatesUnavailableException("s1"));

        mockMvc.perform(get("/api/v1/feed").header("X-User-Id", "u1"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string("Retry-After", "1"))
                .andExpect(jsonPath("$.retryable").value(true));
    }

    @Test
    void recordEvents_validBatch_isAccepted() throws Exception {
        mockMvc.perform(post("/api/v1/feed/events")
                        .header("X-User-Id", "u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sessionId":"s1","events":[
                                  {"type":"VIEW","itemId":"m1","durationWatchedSec":30},
                                  {"type":"LIKE","itemId":"m1"}]}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.accepted").value(2));

        verify(eventPublisher).recordClientEvents(eq("u1"), any(FeedEventBatch.class));
    }

    @Test
    void recordEvents_emptyBatch_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/feed/events")
                        .header("X-User-Id", "u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"s1\",\"events\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void health_reportsBucketCount() throws Exception {
        when(indexPool.bucketCount()).thenReturn(4);

        mockMvc.perform(get("/api/v1/feed/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.indexBuckets").value(4));
    }
}
