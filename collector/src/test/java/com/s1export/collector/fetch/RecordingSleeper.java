package com.s1export.collector.fetch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Sleeper that records requested waits instead of sleeping.
 */
class RecordingSleeper implements Sleeper {

    final List<Duration> sleeps = new ArrayList<>();

    @Override
    public void sleep(Duration duration) {
        sleeps.add(duration);
    }
}
