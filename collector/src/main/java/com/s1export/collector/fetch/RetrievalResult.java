package com.s1export.collector.fetch;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * What one candidate produced. Failed retrievals never carry records: pages
 * fetched before the failure are dropped.
 */
public record RetrievalResult(
        EndpointCandidate candidate,
        RetrievalStatus status,
        List<JsonNode> records,
        int pagesFetched,
        int requestsIssued,
        String reason
) {

    public RetrievalResult {
        records = status.isSuccess() ? List.copyOf(records) : List.of();
    }

    public boolean hasRecords() {
        return !records.isEmpty();
    }
}
