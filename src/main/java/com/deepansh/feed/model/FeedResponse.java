package com.deepansh.feed.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedResponse {

    @Builder.Default
    private List<FeedItem> items = new ArrayList<>();

    private String nextCursor;
    private boolean hasMore;
    private FeedMeta meta;
}
