package com.s1export.collector.sink;

import java.util.List;

/**
 * Result of writing one table. Reports total rows attempted, rows written, and any
 * per-row errors for partial failure reporting.
 */
public record SinkResult(
        String destination,
        int totalRows,
        int writtenRows,
        List<RowError> errors,
        boolean skipped
) {

    public record RowError(long rowIndex, String message) {}

    public static SinkResult written(String destination, int rows) {
        return new SinkResult(destination, rows, rows, List.of(), false);
    }

    public static SinkResult skipped(String destination) {
        return new SinkResult(destination, 0, 0, List.of(), true);
    }

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }
}
