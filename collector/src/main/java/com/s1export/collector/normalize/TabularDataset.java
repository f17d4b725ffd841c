package com.s1export.collector.normalize;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flat table built from a dataset's records. Columns are the union of all row keys in
 * first-seen order; a row simply lacks the columns it has no value for. Cell values are
 * {@code String}, {@code Number}, {@code Boolean} or {@code null}.
 */
public final class TabularDataset {

    private final String name;
    private final List<String> columns;
    private final List<Map<String, Object>> rows;
    private final NormalizationStrategy strategy;

    private TabularDataset(String name, List<String> columns, List<Map<String, Object>> rows,
                           NormalizationStrategy strategy) {
        this.name = name;
        this.columns = columns;
        this.rows = rows;
        this.strategy = strategy;
    }

    /**
     * Builds a table from rows, deriving the column list from the rows' keys.
     */
    public static TabularDataset of(String name, List<Map<String, Object>> rows, NormalizationStrategy strategy) {
        Set<String> columns = new LinkedHashSet<>();
        for (Map<String, Object> row : rows) {
            columns.addAll(row.keySet());
        }
        List<Map<String, Object>> copies = rows.stream()
                .map(row -> Collections.unmodifiableMap(new LinkedHashMap<>(row)))
                .toList();
        return new TabularDataset(name, List.copyOf(columns), copies, strategy);
    }

    public static TabularDataset empty(String name) {
        return new TabularDataset(name, List.of(), List.of(), NormalizationStrategy.EMPTY);
    }

    public String name() {
        return name;
    }

    public List<String> columns() {
        return columns;
    }

    public List<Map<String, Object>> rows() {
        return rows;
    }

    public NormalizationStrategy strategy() {
        return strategy;
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * @return the cell value, or {@code null} when the row has no value for the column
     */
    public Object value(int rowIndex, String column) {
        return rows.get(rowIndex).get(column);
    }

    @Override
    public String toString() {
        return "TabularDataset[" + name + ", " + rows.size() + " rows x " + columns.size()
                + " columns, " + strategy + "]";
    }
}
