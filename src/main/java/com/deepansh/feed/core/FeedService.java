package com.deepansh.feed.core;

import com.deepansh.feed.config.FeedProperties;
import com.deepansh.feed.context.UserContextLoader;
import com.deepansh.feed.exception.FeedDeadlineExceededException;
import com.deepansh.feed.hydration.HydrationResult;
import com.deepansh.feed.hydration.Hydrator;
import com.deepansh.feed.model.CursorPosition;
import com.deepansh.feed.model.FeedMeta;
import com.deepansh.feed.model.FeedPage;
import com.deepansh.feed.model.FeedPlan;
import com.deepansh.feed.model.FeedResponse;
import com.deepansh.feed.model.FeedType;
import com.deepansh.feed.model.UserContext;
import com.deepansh.feed.observability.FeedEventPublisher;
import com.deepansh.feed.pagination.PaginationManager;
import com.deepansh.feed.plan.FeedPlanGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Feed request pipeline.
 *
 * First page (no cursor):
 * 1. Mint a session id
 * 2. Load the user context (sources in parallel)
 * 3. Get or create the session's plan
 * 4. Slice, hydrate, publish SHOWN events
 *
 * Later pages (cursor): decode, load the stored plan, slice, hydrate. The
 * context is not reloaded since the plan already reflects it, and the feed
 * type is the one the plan was created for.
 *
 * The pipeline runs on feedRequestExecutor so the caller can give up at
 * feed.request.deadline-ms. Exceeding feed.request.budget-ms is only logged.
 */
@Service
@Slf4j
public class FeedService {

    private final UserContextLoader contextLoader;
    private final FeedPlanGenerator planGenerator;
    private final PaginationManager paginationManager;
    private final Hydrator hydrator;
    private final FeedEventPublisher eventPublisher;
    private final Executor requestExecutor;
    private final FeedProperties properties;

    public FeedService(UserContextLoader contextLoader,
                       FeedPlanGenerator planGenerator,
                       PaginationManager paginationManager,
                       Hydrator hydrator,
                       FeedEventPublisher eventPublisher,
                       @Qualifier("feedRequestExecutor") Executor requestExecutor,
                       FeedProperties properties) {
        this.contextLoader = contextLoader;
        this.planGenerator = planGenerator;
        this.paginationManager = paginationManager;
        this.hydrator = hydrator;
        this.eventPublisher = eventPublisher;
        this.requestExecutor = requestExecutor;
        this.properties = properties;
    }

    public FeedResponse getFeed(String userId, String cursor, Integer limit, FeedType feedType) {
        int pageSize = resolveLimit(limit);
        FeedType type = feedType != null ? feedType : FeedType.FOR_YOU;
        long deadlineMs = properties.getRequest().getDeadlineMs();

        CompletableFuture<FeedResponse> pipeline = CompletableFuture.supplyAsync(
                () -> assemble(userId, cursor, pageSize, type), requestExecutor);
        try {
            return pipeline.get(deadlineMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pipeline.cancel(true);
            log.error("Feed request exceeded deadline [userId={}, deadline={}ms]", userId, deadlineMs);
            throw new FeedDeadlineExceededException(deadlineMs);
        } catch (ExecutionException e) {
            throw unwrap(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pipeline.cancel(true);
            throw new FeedDeadlineExceededException(deadlineMs);
        }
    }

    FeedResponse assemble(String userId, String cursor, int pageSize, FeedType feedType) {
        RequestTimer timer = new RequestTimer();
        boolean firstPage = cursor == null || cursor.isBlank();

        String sessionId;
        CursorPosition position;
        FeedPlan plan;
        List<String> degradedSources = new ArrayList<>();

        if (firstPage) {
            sessionId = UUID.randomUUID().toString();
            UserContext context = contextLoader.load(userId);
            degradedSources.addAll(context.degradedSources());
            timer.mark("context");

            position = null;
            plan = planGenerator.getOrCreatePlan(sessionId, context, pageSize, feedType);
        } else {
            position = paginationManager.decode(cursor);
            sessionId = position.sessionId();
            plan = paginationManager.resolve(position, userId);
        }
        timer.mark("plan");

        FeedPage page = paginationManager.slice(position, plan, pageSize);
        HydrationResult hydration = hydrator.hydrate(page.itemIds());
        timer.mark("hydrate");

        eventPublisher.publishShown(userId, sessionId, page.itemIds(), page.offset());

        long latencyMs = timer.elapsedMs();
        FeedMeta meta = FeedMeta.builder()
                .sessionId(sessionId)
                .feedType(plan.feedType())
                .offset(page.offset())
                .limit(pageSize)
                .itemCount(hydration.items().size())
                .planSize(plan.size())
                .mix(plan.mixSummary() != null ? plan.mixSummary().counts() : Map.of())
                .substitutions(plan.mixSummary() != null
                        ? new ArrayList<>(plan.mixSummary().substitutions()) : new ArrayList<>())
                .degradedSources(degradedSources)
                .unresolvedCount(hydration.unresolvedIds().size())
                .generatedAt(plan.generatedAt())
                .latencyMs(latencyMs)
                .build();

        if (latencyMs > properties.getRequest().getBudgetMs()) {
            log.warn("Feed request over budget [sessionId={}, latency={}ms, budget={}ms, stages: {}]",
                    sessionId, latencyMs, properties.getRequest().getBudgetMs(), timer.summary());
        }
        log.info("Feed page served [sessionId={}, userId={}, offset={}, items={}, hasMore={}, latency={}ms]",
                sessionId, userId, page.offset(), hydration.items().size(), page.hasMore(), latencyMs);

        return FeedResponse.builder()
                .items(new ArrayList<>(hydration.items()))
                .nextCursor(page.nextCursor())
                .hasMore(page.hasMore())
                .meta(meta)
                .build();
    }

    private int resolveLimit(Integer limit) {
        FeedProperties.Request request = properties.getRequest();
        if (limit == null) {
            return request.getDefaultLimit();
        }
        return Math.max(1, Math.min(limit, request.getMaxLimit()));
    }

    private RuntimeException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new IllegalStateException("Feed pipeline failed", cause);
    }
}
