package com.s1export.collector.client;

import java.io.IOException;
import java.util.Map;

/**
 * Performs a single HTTP GET against the management API. Implementations do not retry;
 * retry and fallback decisions belong to the fetch layer.
 */
public interface TransportClient {

    /**
     * Issues one GET request.
     *
     * @param url    absolute URL without query string
     * @param params query parameters; values are rendered with {@code String.valueOf}
     * @return the status code and body, whatever the status
     * @throws IOException on connectivity faults and timeouts
     */
    TransportResponse get(String url, Map<String, ?> params) throws IOException;
}
