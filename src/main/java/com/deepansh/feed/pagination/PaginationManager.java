package com.deepansh.feed.pagination;

import com.deepansh.feed.exception.ExpiredSessionException;
import com.deepansh.feed.exception.InvalidCursorException;
import com.deepansh.feed.model.CursorPosition;
import com.deepansh.feed.model.FeedPage;
import com.deepansh.feed.model.FeedPlan;
import com.deepansh.feed.plan.FeedPlanStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Turns cursors into plan slices. Slicing is a pure read over the immutable
 * plan; the cursor carries the offset, so no per-page state is stored.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PaginationManager {

    private final CursorCodec cursorCodec;
    private final FeedPlanStore planStore;

    public CursorPosition decode(String cursor) {
        return cursorCodec.decode(cursor);
    }

    /**
     * Loads the plan a cursor points into.
     *
     * @throws ExpiredSessionException if the plan is gone
     * @throws InvalidCursorException  if the plan belongs to another user
     */
    public FeedPlan resolve(CursorPosition position, String userId) {
        FeedPlan plan = planStore.find(position.sessionId())
                .filter(p -> !p.isExpired(Instant.now()))
                .orElseThrow(() -> new ExpiredSessionException(position.sessionId()));

        if (userId != null && !userId.equals(plan.userId())) {
            log.warn("Cursor presented by another user [sessionId={}, userId={}]", position.sessionId(), userId);
            throw new InvalidCursorException("session does not belong to caller");
        }
        return plan;
    }

    public FeedPlan resolve(String cursor, String userId) {
        return resolve(decode(cursor), userId);
    }

    /**
     * Page of up to pageSize ids starting at the cursor offset, or at 0 when
     * position is null.
     */
    public FeedPage slice(CursorPosition position, FeedPlan plan, int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive");
        }
        int offset = position != null ? position.offset() : 0;
        if (offset >= plan.size()) {
            return new FeedPage(List.of(), offset, null, false);
        }

        int end = Math.min(offset + pageSize, plan.size());
        boolean hasMore = end < plan.size();
        String nextCursor = hasMore
                ? cursorCodec.encode(new CursorPosition(plan.planId(), end))
                : null;
        return new FeedPage(plan.itemIds().subList(offset, end), offset, nextCursor, hasMore);
    }
}
