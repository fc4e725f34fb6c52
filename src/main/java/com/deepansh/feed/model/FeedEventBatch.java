package com.deepansh.feed.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Batch of client-side consumption events (clients flush every ~30s).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FeedEventBatch {

    private String sessionId;

    @NotEmpty(message = "events must not be empty")
    @Size(max = 200, message = "at most 200 events per batch")
    private List<@Valid Event> events;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Event {

        @NotNull(message = "type is required")
        private FeedEventType type;

        @NotBlank(message = "itemId must not be blank")
        private String itemId;

        @PositiveOrZero
        private Integer durationWatchedSec;

        /** Defaults to receive time when absent */
        private Instant occurredAt;
    }
}
