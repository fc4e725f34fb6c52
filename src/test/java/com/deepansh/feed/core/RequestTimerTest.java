package com.deepansh.feed.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RequestTimerTest {

    @Test
    void summary_listsStagesInOrder() {
        RequestTimer timer = new RequestTimer();
        timer.mark("context");
        timer.mark("plan");

        assertThat(timer.getStages()).extracting(RequestTimer.StageRecord::stage).containsExactly("context", "plan");
        assertThat(timer.summary()).startsWith("context=").contains(" plan=");
        assertThat(timer.elapsedMs()).isGreaterThanOrEqualTo(0);
    }
}
