package com.s1export.collector.orchestrator;

import com.s1export.collector.fetch.Provenance;
import com.s1export.collector.normalize.TabularDataset;

/**
 * Holds the result of collecting a single dataset. Tracks record counts, where the
 * records came from, where they went, and duration for summary reporting.
 */
public record DatasetResult(
        String datasetName,
        boolean success,
        int recordCount,
        int rowsWritten,
        Provenance provenance,
        String sourceUrl,
        String destination,
        boolean truncated,
        String errorMessage,
        long durationMs,
        TabularDataset table
) {

    public static DatasetResult success(String datasetName, int recordCount, int rowsWritten,
                                        Provenance provenance, String sourceUrl, String destination,
                                        boolean truncated, long durationMs, TabularDataset table) {
        return new DatasetResult(datasetName, true, recordCount, rowsWritten, provenance, sourceUrl,
                destination, truncated, null, durationMs, table);
    }

    /**
     * A dataset whose endpoints produced no records.
     */
    public static DatasetResult noData(String datasetName, String reason, String destination,
                                       long durationMs, TabularDataset table) {
        return new DatasetResult(datasetName, false, 0, 0, Provenance.NONE, null, destination, false,
                reason, durationMs, table);
    }

    public static DatasetResult failure(String datasetName, String error, long durationMs) {
        return new DatasetResult(datasetName, false, 0, 0, Provenance.NONE, null, null, false,
                error, durationMs, TabularDataset.empty(datasetName));
    }

    public int columnCount() {
        return table == null ? 0 : table.columnCount();
    }
}
