package com.s1export.collector.fetch;

import java.time.Duration;

/**
 * Working inter-request delay for one dataset's retrieval. Doubles on every
 * rate-limit response, up to a ceiling, and is discarded with the retrieval.
 * Not thread-safe; never shared between datasets.
 */
public class Throttle {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private Duration currentDelay;

    public Throttle(Duration initialDelay, Duration maxDelay) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay.compareTo(initialDelay) < 0 ? initialDelay : maxDelay;
        this.currentDelay = initialDelay;
    }

    /**
     * Doubles the working delay, capped at the maximum.
     *
     * @return the new delay
     */
    public Duration escalate() {
        Duration doubled = currentDelay.isZero() ? Duration.ofSeconds(1) : currentDelay.multipliedBy(2);
        currentDelay = doubled.compareTo(maxDelay) > 0 ? maxDelay : doubled;
        return currentDelay;
    }

    public Duration currentDelay() {
        return currentDelay;
    }

    public Duration initialDelay() {
        return initialDelay;
    }

    public boolean isEscalated() {
        return currentDelay.compareTo(initialDelay) > 0;
    }
}
