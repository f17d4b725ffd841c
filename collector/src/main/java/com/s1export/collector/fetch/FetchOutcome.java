package com.s1export.collector.fetch;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Final result of fetching one dataset. Finding nothing is a normal outcome with
 * provenance {@link Provenance#NONE}, not an error.
 *
 * @param records             records in server order across all pages
 * @param provenance          kind of candidate that supplied the records
 * @param source              that candidate, or {@code null} when nothing was found
 * @param candidatesAttempted how many candidates were tried
 * @param truncated           whether the page ceiling cut the retrieval short
 * @param lastStatus          status of the last candidate tried, or {@code null} if none was
 * @param reason              description of the last candidate's result
 */
public record FetchOutcome(
        List<JsonNode> records,
        Provenance provenance,
        EndpointCandidate source,
        int candidatesAttempted,
        boolean truncated,
        RetrievalStatus lastStatus,
        String reason
) {

    public FetchOutcome {
        records = List.copyOf(records);
    }

    static FetchOutcome found(RetrievalResult result, int candidatesAttempted) {
        return new FetchOutcome(result.records(), result.candidate().source(), result.candidate(),
                candidatesAttempted, result.status() == RetrievalStatus.TRUNCATED, result.status(),
                result.reason());
    }

    static FetchOutcome none(int candidatesAttempted, RetrievalStatus lastStatus, String reason) {
        return new FetchOutcome(List.of(), Provenance.NONE, null, candidatesAttempted, false, lastStatus, reason);
    }

    public boolean hasRecords() {
        return !records.isEmpty();
    }

    public int recordCount() {
        return records.size();
    }
}
