package com.deepansh.feed.observability;

import com.deepansh.feed.dedup.DedupStore;
import com.deepansh.feed.model.FeedEventBatch;
import com.deepansh.feed.model.FeedEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Analytics egress for feed events.
 *
 * Everything here runs on feedEventExecutor and never blocks or fails the feed
 * response. Shown and consumed items are also added to the account filter so
 * later sessions rank them lower.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FeedEventPublisher {

    /** Client events that count as the user having seen the item */
    private static final Set<FeedEventType> CONSUMED = EnumSet.of(
            FeedEventType.VIEW, FeedEventType.COMPLETE, FeedEventType.SKIP,
            FeedEventType.LIKE, FeedEventType.SHARE, FeedEventType.SAVE);

    private final FeedEventRepository eventRepository;
    private final DedupStore dedupStore;

    /**
     * Records a SHOWN event per served item, offset being the position of the
     * first item in the plan.
     */
    @Async("feedEventExecutor")
    public void publishShown(String userId, String sessionId, List<String> itemIds, int offset) {
        if (itemIds.isEmpty()) return;
        try {
            Instant now = Instant.now();
            List<FeedEventDocument> events = new ArrayList<>(itemIds.size());
            for (int i = 0; i < itemIds.size(); i++) {
                events.add(FeedEventDocument.builder()
                        .userId(userId)
                        .sessionId(sessionId)
                        .itemId(itemIds.get(i))
                        .type(FeedEventType.SHOWN)
                        .position(offset + i)
                        .occurredAt(now)
                        .build());
            }
            eventRepository.saveAll(events);
            dedupStore.accountMark(userId, itemIds);

            log.debug("Shown events published [sessionId={}, offset={}, count={}]",
                    sessionId, offset, itemIds.size());
        } catch (Exception e) {
            // Analytics loss is acceptable; the page was already served
            log.error("Failed to publish shown events [sessionId={}]", sessionId, e);
        }
    }

    @Async("feedEventExecutor")
    public void recordClientEvents(String userId, FeedEventBatch batch) {
        try {
            Instant received = Instant.now();
            List<FeedEventDocument> events = new ArrayList<>(batch.getEvents().size());
            Set<String> consumed = new LinkedHashSet<>();

            for (FeedEventBatch.Event event : batch.getEvents()) {
                events.add(FeedEventDocument.builder()
                        .userId(userId)
                        .sessionId(batch.getSessionId())
                        .itemId(event.getItemId())
                        .type(event.getType())
                        .durationWatchedSec(event.getDurationWatchedSec())
                        .occurredAt(event.getOccurredAt() != null ? event.getOccurredAt() : received)
                        .build());
                if (CONSUMED.contains(event.getType())) {
                    consumed.add(event.getItemId());
                }
            }

            eventRepository.saveAll(events);
            if (!consumed.isEmpty()) {
                dedupStore.accountMark(userId, consumed);
            }

            log.info("Client events recorded [userId={}, sessionId={}, events={}, consumed={}]",
                    userId, batch.getSessionId(), events.size(), consumed.size());
        } catch (Exception e) {
            log.error("Failed to record client events [userId={}]", userId, e);
        }
    }
}
