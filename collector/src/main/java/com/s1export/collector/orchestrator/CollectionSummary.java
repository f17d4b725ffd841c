package com.s1export.collector.orchestrator;

import com.s1export.collector.normalize.TabularDataset;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Aggregated summary of a collection run. Provides convenience methods for querying
 * results by dataset and computing overall success/failure counts.
 */
public record CollectionSummary(
        List<DatasetResult> results,
        long totalDurationMs
) {

    public int successCount() {
        return (int) results.stream().filter(DatasetResult::success).count();
    }

    public int failureCount() {
        return (int) results.stream().filter(r -> !r.success()).count();
    }

    public boolean hasFailures() {
        return results.stream().anyMatch(r -> !r.success());
    }

    public int totalRecords() {
        return results.stream().mapToInt(DatasetResult::recordCount).sum();
    }

    public Optional<DatasetResult> find(String datasetName) {
        return results.stream().filter(r -> r.datasetName().equals(datasetName)).findFirst();
    }

    /**
     * Dataset name to its table, in run order.
     */
    public Map<String, TabularDataset> tables() {
        Map<String, TabularDataset> tables = new LinkedHashMap<>();
        results.forEach(r -> tables.put(r.datasetName(), r.table()));
        return tables;
    }

    public String headline() {
        return successCount() + " of " + results.size() + " datasets collected successfully";
    }
}
