package com.s1export.collector.fetch;

import java.time.Duration;

/**
 * Every wait in the fetch layer goes through this seam so tests can observe
 * backoff and pacing without sleeping.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (!duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
