package com.s1export.collector.config;

import java.util.List;

/**
 * The base URLs a run talks to. A pinned target never falls back to another base.
 *
 * @param primaryBaseUrl   base URL tried first for every dataset
 * @param fallbackBaseUrls other API versions, in order; always empty when pinned
 * @param pinned           whether the operator set an explicit base URL
 */
public record ApiTarget(String primaryBaseUrl, List<String> fallbackBaseUrls, boolean pinned) {

    public ApiTarget {
        if (primaryBaseUrl == null || primaryBaseUrl.isBlank()) {
            throw new IllegalArgumentException("Primary base URL must not be blank");
        }
        fallbackBaseUrls = pinned || fallbackBaseUrls == null ? List.of() : List.copyOf(fallbackBaseUrls);
    }

    public static ApiTarget pinned(String baseUrl) {
        return new ApiTarget(baseUrl, List.of(), true);
    }
}
