package com.s1export.collector.fetch;

/**
 * One (base URL, path) pair to try for a dataset.
 */
public record EndpointCandidate(String baseUrl, String path, Provenance source) {

    public String url() {
        return baseUrl + path;
    }

    @Override
    public String toString() {
        return source + " " + url();
    }
}
