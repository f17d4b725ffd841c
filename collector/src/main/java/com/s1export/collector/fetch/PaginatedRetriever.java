package com.s1export.collector.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.s1export.collector.client.TransportClient;
import com.s1export.collector.client.TransportResponse;
import com.s1export.collector.config.DatasetDescriptor;
import com.s1export.collector.config.FetchSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pulls every page of a dataset from one endpoint candidate, with exponential backoff
 * on transient faults and cursor-based pagination.
 *
 * <p>A candidate gets {@link FetchSettings#maxAttempts()} failed attempts in total,
 * counted across all of its pages. 401/403 and unreadable payloads end the
 * retrieval at once. Pages are spaced by the larger of the throttle delay and the
 * configured minimum interval, and retrieval stops after
 * {@link FetchSettings#pageCeiling()} pages even when the server keeps returning a
 * cursor.</p>
 */
public class PaginatedRetriever {

    private static final Logger logger = LoggerFactory.getLogger(PaginatedRetriever.class);

    private final TransportClient transport;
    private final FetchSettings settings;
    private final Sleeper sleeper;
    private final ObjectMapper objectMapper;

    public PaginatedRetriever(TransportClient transport, FetchSettings settings, Sleeper sleeper) {
        this.transport = transport;
        this.settings = settings;
        this.sleeper = sleeper;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Retrieves all pages of {@code descriptor} from {@code candidate}.
     *
     * @param throttle the dataset's throttle; escalated in place on 429 responses
     * @return the accumulated records, or a failure status with no records
     */
    public RetrievalResult retrieve(DatasetDescriptor descriptor, EndpointCandidate candidate, Throttle throttle)
            throws InterruptedException {
        List<JsonNode> records = new ArrayList<>();
        String cursor = null;
        int pages = 0;
        int requests = 0;
        int attempt = 0;

        while (true) {
            FetchAttemptResult result = attempt(candidate.url(), requestParams(descriptor, cursor));
            requests++;

            switch (result.kind()) {
                case SUCCESS -> {
                    PageEnvelope page = result.page();
                    records.addAll(page.records());
                    pages++;
                    logger.debug("[{}] page {} from {}: {} records (total so far {}{})",
                            descriptor.name(), pages, candidate.url(), page.records().size(), records.size(),
                            page.totalItems() != null ? " of " + page.totalItems() : "");

                    if (!descriptor.paginate() || !page.hasNextPage()) {
                        return new RetrievalResult(candidate, RetrievalStatus.COMPLETED, records, pages,
                                requests, "completed after " + pages + " page(s)");
                    }
                    if (pages >= settings.pageCeiling()) {
                        logger.warn("[{}] Page ceiling of {} reached at {}; returning {} records, "
                                + "remaining pages not fetched", descriptor.name(), settings.pageCeiling(),
                                candidate.url(), records.size());
                        return new RetrievalResult(candidate, RetrievalStatus.TRUNCATED, records, pages,
                                requests, "truncated at " + pages + " pages");
                    }
                    sleeper.sleep(interPageDelay(throttle));
                    cursor = page.nextCursor();
                }
                case AUTH_REJECTED -> {
                    logger.error("[{}] {} rejected the API token ({}); not retrying",
                            descriptor.name(), candidate.url(), result.reason());
                    return failure(candidate, RetrievalStatus.AUTH_FAILED, records, pages, requests, result);
                }
                case FATAL_FAULT -> {
                    logger.error("[{}] Unrecoverable fault from {}: {}",
                            descriptor.name(), candidate.url(), result.reason());
                    return failure(candidate, RetrievalStatus.FATAL, records, pages, requests, result);
                }
                default -> {
                    if (result.kind() == FetchAttemptResult.Kind.RATE_LIMITED) {
                        Duration escalated = throttle.escalate();
                        logger.warn("[{}] Rate limited by {}; request delay raised to {}ms",
                                descriptor.name(), candidate.url(), escalated.toMillis());
                    }

                    attempt++;
                    if (attempt >= settings.maxAttempts()) {
                        RetrievalStatus status = result.kind() == FetchAttemptResult.Kind.NOT_FOUND
                                ? RetrievalStatus.NOT_FOUND : RetrievalStatus.RETRIES_EXHAUSTED;
                        logger.warn("[{}] Giving up on {} after {} attempts: {}",
                                descriptor.name(), candidate.url(), attempt, result.reason());
                        return failure(candidate, status, records, pages, requests, result);
                    }

                    Duration wait = retryDelay(attempt, result, throttle);
                    logger.warn("[{}] {} from {}. Retrying in {}ms (attempt {}/{})",
                            descriptor.name(), result.reason(), candidate.url(), wait.toMillis(),
                            attempt + 1, settings.maxAttempts());
                    sleeper.sleep(wait);
                }
            }
        }
    }

    /**
     * Issues one call and classifies it. Never throws for HTTP or payload problems.
     */
    FetchAttemptResult attempt(String url, Map<String, Object> params) {
        TransportResponse response;
        try {
            response = transport.get(url, params);
        } catch (IOException e) {
            return FetchAttemptResult.fault(FetchAttemptResult.Kind.RETRYABLE_FAULT, -1,
                    "connection fault (" + e.getClass().getSimpleName() + ": " + e.getMessage() + ")");
        } catch (RuntimeException e) {
            return FetchAttemptResult.fault(FetchAttemptResult.Kind.FATAL_FAULT, -1,
                    "unexpected transport fault: " + e);
        }

        int status = response.statusCode();
        if (status == 401 || status == 403) {
            return FetchAttemptResult.fault(FetchAttemptResult.Kind.AUTH_REJECTED, status, "HTTP " + status);
        }
        if (status == 429) {
            return FetchAttemptResult.rateLimited("HTTP 429", response.retryAfter());
        }
        if (status == 404) {
            return FetchAttemptResult.fault(FetchAttemptResult.Kind.NOT_FOUND, status, "HTTP 404");
        }
        if (!response.isSuccessful()) {
            return FetchAttemptResult.fault(FetchAttemptResult.Kind.RETRYABLE_FAULT, status, "HTTP " + status);
        }

        try {
            JsonNode body = response.body() == null ? null : objectMapper.readTree(response.body());
            return FetchAttemptResult.success(status, PageEnvelope.from(body));
        } catch (JsonProcessingException e) {
            return FetchAttemptResult.fault(FetchAttemptResult.Kind.FATAL_FAULT, status,
                    "unreadable JSON payload: " + e.getOriginalMessage());
        }
    }

    /**
     * Backoff before retry number {@code attempt}: base × 2^(attempt-1). A 429 waits at
     * least as long as the escalated throttle delay and the server hint, the hint being
     * capped at {@link FetchSettings#maxThrottleDelay()}.
     */
    Duration retryDelay(int attempt, FetchAttemptResult result, Throttle throttle) {
        Duration backoff = settings.baseRetryDelay().multipliedBy(1L << (attempt - 1));
        if (result.kind() != FetchAttemptResult.Kind.RATE_LIMITED) {
            return backoff;
        }
        Duration wait = max(backoff, throttle.currentDelay());
        return result.retryAfter()
                .map(hint -> max(wait, min(hint, settings.maxThrottleDelay())))
                .orElse(wait);
    }

    Duration interPageDelay(Throttle throttle) {
        return max(throttle.currentDelay(), settings.minPageInterval());
    }

    private Map<String, Object> requestParams(DatasetDescriptor descriptor, String cursor) {
        Map<String, Object> params = new LinkedHashMap<>(descriptor.params());
        if (cursor != null) {
            params.put(settings.cursorParam(), cursor);
        }
        return params;
    }

    private RetrievalResult failure(EndpointCandidate candidate, RetrievalStatus status, List<JsonNode> records,
                                    int pages, int requests, FetchAttemptResult last) {
        if (!records.isEmpty()) {
            logger.warn("Discarding {} records from {} page(s) of {} after failure",
                    records.size(), pages, candidate.url());
        }
        return new RetrievalResult(candidate, status, List.of(), pages, requests, last.reason());
    }

    private static Duration max(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
