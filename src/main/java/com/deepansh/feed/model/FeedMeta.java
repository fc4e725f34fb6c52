package com.deepansh.feed.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedMeta {

    private String sessionId;
    private FeedType feedType;
    private int offset;
    private int limit;
    private int itemCount;
    private int planSize;
    private Map<String, Integer> mix;

    @Builder.Default
    private List<String> substitutions = new ArrayList<>();

    /** Context sources replaced by empty values for this request */
    @Builder.Default
    private List<String> degradedSources = new ArrayList<>();

    /** Planned ids omitted because no metadata could be resolved */
    private int unresolvedCount;

    private Instant generatedAt;
    private long latencyMs;
}
