package com.deepansh.feed.core;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Per-request stage timings. Created when a feed request starts and logged
 * with the outcome, so slow requests show which stage ate the budget.
 */
@Getter
public class RequestTimer {

    private final long startTimeMs = System.currentTimeMillis();
    private final List<StageRecord> stages = new ArrayList<>();
    private long lastMarkMs = startTimeMs;

    public void mark(String stage) {
        long now = System.currentTimeMillis();
        stages.add(new StageRecord(stage, now - lastMarkMs));
        lastMarkMs = now;
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    /** e.g. "context=12ms plan=30ms slice=0ms hydrate=41ms" */
    public String summary() {
        return stages.stream()
                .map(s -> s.stage() + "=" + s.durationMs() + "ms")
                .collect(Collectors.joining(" "));
    }

    public record StageRecord(String stage, long durationMs) {}
}
