package com.s1export.collector.fetch;

import java.time.Duration;
import java.util.Optional;

/**
 * Classified outcome of one HTTP call.
 *
 * @param kind       what the fetch layer should do next
 * @param statusCode HTTP status, or {@code -1} for faults without a response
 * @param page       decoded page for {@link Kind#SUCCESS}, otherwise {@code null}
 * @param reason     short description for logs and summaries
 * @param retryAfter server wait hint, if any
 */
public record FetchAttemptResult(Kind kind, int statusCode, PageEnvelope page, String reason,
                                 Optional<Duration> retryAfter) {

    public enum Kind {
        SUCCESS,
        /** Connectivity faults, timeouts and HTTP errors without a dedicated rule. */
        RETRYABLE_FAULT,
        /** HTTP 429: retryable, and slows the rest of the retrieval down. */
        RATE_LIMITED,
        /** HTTP 404: retryable, but reported as not-found once the attempts run out. */
        NOT_FOUND,
        /** HTTP 401/403: the credential is rejected everywhere, never retried. */
        AUTH_REJECTED,
        /** Unreadable payloads and other unexpected faults, never retried. */
        FATAL_FAULT
    }

    public static FetchAttemptResult success(int statusCode, PageEnvelope page) {
        return new FetchAttemptResult(Kind.SUCCESS, statusCode, page, "HTTP " + statusCode, Optional.empty());
    }

    public static FetchAttemptResult fault(Kind kind, int statusCode, String reason) {
        return new FetchAttemptResult(kind, statusCode, null, reason, Optional.empty());
    }

    public static FetchAttemptResult rateLimited(String reason, Optional<Duration> retryAfter) {
        return new FetchAttemptResult(Kind.RATE_LIMITED, 429, null, reason, retryAfter);
    }
}
