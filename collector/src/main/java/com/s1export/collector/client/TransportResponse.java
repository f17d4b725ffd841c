package com.s1export.collector.client;

import java.time.Duration;
import java.util.Optional;

/**
 * Raw outcome of one HTTP call.
 *
 * @param statusCode HTTP status
 * @param body       response body text, or {@code null} when the server sent none
 * @param retryAfter server-provided wait hint from the {@code Retry-After} header, if any
 */
public record TransportResponse(int statusCode, String body, Optional<Duration> retryAfter) {

    public TransportResponse {
        retryAfter = retryAfter == null ? Optional.empty() : retryAfter;
    }

    public static TransportResponse of(int statusCode, String body) {
        return new TransportResponse(statusCode, body, Optional.empty());
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
