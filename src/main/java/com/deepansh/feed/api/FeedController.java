package com.deepansh.feed.api;

import com.deepansh.feed.core.FeedService;
import com.deepansh.feed.index.CandidateIndexPool;
import com.deepansh.feed.model.FeedEventBatch;
import com.deepansh.feed.model.FeedResponse;
import com.deepansh.feed.model.FeedType;
import com.deepansh.feed.observability.FeedEventPublisher;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Feed endpoints. The gateway authenticates the caller and forwards the
 * verified user id in X-User-Id.
 *
 * GET  /api/v1/feed?cursor=&limit=&feedType=   first page without cursor, next pages with
 *                                            nextCursor; feedType is for_you (default) or trending
 *                                            and is fixed for the session by its first page
 * POST /api/v1/feed/events           client consumption events, 202 Accepted
 * GET  /api/v1/feed/health
 */
@RestController
@RequestMapping("/api/v1/feed")
@RequiredArgsConstructor
@Slf4j
public class FeedController {

    static final String USER_HEADER = "X-User-Id";

    private final FeedService feedService;
    private final FeedEventPublisher eventPublisher;
    private final CandidateIndexPool indexPool;

    @GetMapping
    public ResponseEntity<FeedResponse> getFeed(
            @RequestHeader(USER_HEADER) String userId,
            @RequestParam(required = false) String cursor,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) Integer limit,
            @RequestParam(defaultValue = "for_you")
            @Pattern(regexp = "for_you|trending", message = "feedType must be for_you or trending") String feedType) {

        log.debug("Feed request [userId={}, hasCursor={}, limit={}, feedType={}]",
                userId, cursor != null, limit, feedType);
        return ResponseEntity.ok(feedService.getFeed(userId, cursor, limit, FeedType.fromValue(feedType)));
    }

    @PostMapping("/events")
    public ResponseEntity<Map<String, Object>> recordEvents(
            @RequestHeader(USER_HEADER) String userId,
            @Valid @RequestBody FeedEventBatch batch) {

        eventPublisher.recordClientEvents(userId, batch);
        return ResponseEntity.accepted().body(Map.of("accepted", batch.getEvents().size()));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "indexBuckets", indexPool.bucketCount()));
    }
}
