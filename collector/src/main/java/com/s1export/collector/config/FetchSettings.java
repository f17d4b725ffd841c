package com.s1export.collector.config;

import java.time.Duration;

/**
 * Retry, pacing and pagination limits for the fetch layer.
 *
 * @param maxAttempts        failed attempts a candidate may use before it is given up
 * @param baseRetryDelay     first backoff; doubles on every further retry
 * @param pageCeiling        pages fetched from one candidate before stopping with a truncation warning
 * @param minPageInterval    lower bound for the wait between two pages
 * @param maxThrottleDelay   upper bound for the 429-escalated delay
 * @param cursorParam        query parameter carrying the next-page cursor
 */
public record FetchSettings(
        int maxAttempts,
        Duration baseRetryDelay,
        int pageCeiling,
        Duration minPageInterval,
        Duration maxThrottleDelay,
        String cursorParam
) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(2);
    public static final int DEFAULT_PAGE_CEILING = 100;
    public static final Duration DEFAULT_MAX_THROTTLE_DELAY = Duration.ofSeconds(60);

    public FetchSettings {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        if (pageCeiling < 1) {
            throw new IllegalArgumentException("pageCeiling must be at least 1: " + pageCeiling);
        }
    }

    public static FetchSettings defaults(Duration minPageInterval) {
        return new FetchSettings(DEFAULT_MAX_ATTEMPTS, DEFAULT_RETRY_DELAY, DEFAULT_PAGE_CEILING,
                minPageInterval, DEFAULT_MAX_THROTTLE_DELAY, "cursor");
    }

    public static FetchSettings defaults() {
        return defaults(Duration.ZERO);
    }
}
