package com.deepansh.feed.observability;

import com.deepansh.feed.dedup.DedupStore;
import com.deepansh.feed.exception.DedupStoreUnavailableException;
import com.deepansh.feed.model.FeedEventBatch;
import com.deepansh.feed.model.FeedEventType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class FeedEventPublisherTest {

    @Mock FeedEventRepository eventRepository;
    @Mock DedupStore dedupStore;

    @InjectMocks
    FeedEventPublisher publisher;

    @Captor ArgumentCaptor<List<FeedEventDocument>> eventsCaptor;

    @Test
    void publishShown_savesOneEventPerItemWithPlanPosition() {
        publisher.publishShown("u1", "s1", List.of("a", "b"), 10);

        verify(eventRepository).saveAll(eventsCaptor.capture());
        assertThat(eventsCaptor.getValue())
                .extracting(FeedEventDocument::getItemId, FeedEventDocument::getPosition, FeedEventDocument::getType)
                .containsExactly(
                        tuple("a", 10, FeedEventType.SHOWN),
                        tuple("b", 11, FeedEventType.SHOWN));
        verify(dedupStore).accountMark("u1", List.of("a", "b"));
    }

    @Test
    void publishShown_emptyPage_doesNothing() {
        publisher.publishShown("u1", "s1", List.of(), 0);

        verifyNoInteractions(eventRepository, dedupStore);
    }

    @Test
    void publishShown_dedupFailure_isSwallowed() {
        doThrow(new DedupStoreUnavailableException("accountMark", new RuntimeException("down")))
                .when(dedupStore).accountMark(anyString(), anyCollection());

        publisher.publishShown("u1", "s1", List.of("a"), 0);

        verify(eventRepository).saveAll(eventsCaptor.capture());
    }

    @Test
    void recordClientEvents_marksOnlyConsumedItems() {
        FeedEventBatch batch = new FeedEventBatch("s1", List.of(
                FeedEventBatch.Event.builder().type(FeedEventType.VIEW).itemId("a").durationWatchedSec(12).build(),
                FeedEventBatch.Event.builder().type(FeedEventType.SHOWN).itemId("b").build(),
                FeedEventBatch.Event.builder().type(FeedEventType.LIKE).itemId("a").build()));

        publisher.recordClientEvents("u1", batch);

        verify(eventRepository).saveAll(eventsCaptor.capture());
        assertThat(eventsCaptor.getValue()).hasSize(3).allSatisfy(e -> assertThat(e.getOccurredAt()).isNotNull());
        verify(dedupStore).accountMark("u1", Set.of("a"));
    }

    @Test
    void recordClientEvents_onlyShownEvents_skipsAccountFilter() {
        FeedEventBatch batch = new FeedEventBatch("s1", List.of(
                FeedEventBatch.Event.builder().type(FeedEventType.SHOWN).itemId("b").build()));

        publisher.recordClientEvents("u1", batch);

        verify(dedupStore, never()).accountMark(anyString(), anyCollection());
    }
}
