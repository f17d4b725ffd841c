package com.s1export.collector.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Turns loosely-typed JSON records into a {@link TabularDataset}.
 *
 * <p>Strategies are tried in order until one produces a table:
 * <ol>
 *   <li>no records: an empty table</li>
 *   <li>only scalars: one {@code value} column; other non-mapping elements are
 *       wrapped as a {@code data} cell next to the mapping records</li>
 *   <li>one-level flattening of nested mappings into {@code parent_child} columns,
 *       given up when a flattened name collides with an existing key</li>
 *   <li>top-level columns only, nested values as JSON text</li>
 *   <li>each record serialized whole into a {@code data} column</li>
 * </ol>
 * The last step cannot fail, so {@link #normalize} always returns a table.</p>
 */
public class SchemaNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(SchemaNormalizer.class);

    static final String VALUE_COLUMN = "value";
    static final String DATA_COLUMN = "data";
    static final String SEPARATOR = "_";

    /**
     * Normalizes a raw payload that may be a list, a single mapping or a scalar.
     */
    public TabularDataset normalize(JsonNode payload, String datasetName) {
        if (payload == null || payload.isMissingNode() || payload.isNull()) {
            return normalize(List.of(), datasetName);
        }
        if (payload.isArray()) {
            List<JsonNode> records = new ArrayList<>(payload.size());
            payload.forEach(records::add);
            return normalize(records, datasetName);
        }
        return normalize(List.of(payload), datasetName);
    }

    public TabularDataset normalize(List<JsonNode> records, String datasetName) {
        if (records == null || records.isEmpty()) {
            logger.info("[{}] No records to normalize; producing an empty table", datasetName);
            return TabularDataset.empty(datasetName);
        }

        boolean allMappings = records.stream().allMatch(SchemaNormalizer::isMapping);
        if (!allMappings && records.stream().allMatch(SchemaNormalizer::isScalar)) {
            Optional<TabularDataset> scalars = attempt(datasetName, "scalar projection",
                    () -> Optional.of(scalarValues(records, datasetName)));
            if (scalars.isPresent()) {
                return scalars.get();
            }
        }

        List<JsonNode> coerced = allMappings ? records : coerceToMappings(records);
        if (!allMappings) {
            logger.warn("[{}] {} of {} records are not mappings; wrapped into a '{}' column",
                    datasetName, records.stream().filter(r -> !isMapping(r)).count(), records.size(), DATA_COLUMN);
        }

        Optional<TabularDataset> flattened = attempt(datasetName, "flattening",
                () -> flatten(coerced, datasetName));
        if (flattened.isPresent()) {
            return flattened.get();
        }
        logger.warn("[{}] Records cannot be flattened to one column set; keeping top-level columns", datasetName);

        Optional<TabularDataset> union = attempt(datasetName, "column union",
                () -> columnUnion(coerced, datasetName));
        if (union.isPresent()) {
            return union.get();
        }
        logger.warn("[{}] Column union failed; serializing each record into '{}'", datasetName, DATA_COLUMN);

        return stringify(records, datasetName);
    }

    // -------------------------------------------------------------------------
    // Strategies
    // -------------------------------------------------------------------------

    Optional<TabularDataset> flatten(List<JsonNode> records, String datasetName) {
        List<Map<String, Object>> rows = new ArrayList<>(records.size());
        for (JsonNode record : records) {
            Map<String, Object> row = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = record.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                if (value.isObject()) {
                    Iterator<Map.Entry<String, JsonNode>> children = value.fields();
                    while (children.hasNext()) {
                        Map.Entry<String, JsonNode> child = children.next();
                        if (!putUnique(row, field.getKey() + SEPARATOR + child.getKey(), cell(child.getValue()))) {
                            return Optional.empty();
                        }
                    }
                } else if (!putUnique(row, field.getKey(), cell(value))) {
                    return Optional.empty();
                }
            }
            rows.add(row);
        }
        return Optional.of(TabularDataset.of(datasetName, rows, NormalizationStrategy.FLATTENED));
    }

    Optional<TabularDataset> columnUnion(List<JsonNode> records, String datasetName) {
        List<Map<String, Object>> rows = new ArrayList<>(records.size());
        for (JsonNode record : records) {
            Map<String, Object> row = new LinkedHashMap<>();
            record.fields().forEachRemaining(field -> row.put(field.getKey(), cell(field.getValue())));
            rows.add(row);
        }
        return Optional.of(TabularDataset.of(datasetName, rows, NormalizationStrategy.COLUMN_UNION));
    }

    TabularDataset scalarValues(List<JsonNode> records, String datasetName) {
        List<Map<String, Object>> rows = new ArrayList<>(records.size());
        for (JsonNode record : records) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(VALUE_COLUMN, cell(record));
            rows.add(row);
        }
        return TabularDataset.of(datasetName, rows, NormalizationStrategy.SCALAR_VALUES);
    }

    TabularDataset stringify(List<JsonNode> records, String datasetName) {
        if (records.stream().allMatch(SchemaNormalizer::isScalar)) {
            return scalarValues(records, datasetName);
        }
        List<Map<String, Object>> rows = new ArrayList<>(records.size());
        for (JsonNode record : records) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(DATA_COLUMN, record == null ? null : record.toString());
            rows.add(row);
        }
        return TabularDataset.of(datasetName, rows, NormalizationStrategy.STRINGIFIED);
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private List<JsonNode> coerceToMappings(List<JsonNode> records) {
        List<JsonNode> coerced = new ArrayList<>(records.size());
        for (JsonNode record : records) {
            if (record != null && record.isObject()) {
                coerced.add(record);
            } else {
                coerced.add(JsonNodeFactory.instance.objectNode()
                        .put(DATA_COLUMN, record == null || record.isNull() ? null : textOf(record)));
            }
        }
        return coerced;
    }

    private <T> Optional<T> attempt(String datasetName, String stage, Supplier<Optional<T>> strategy) {
        try {
            return strategy.get();
        } catch (RuntimeException e) {
            logger.warn("[{}] Normalization step '{}' failed: {}", datasetName, stage, e.toString());
            return Optional.empty();
        }
    }

    private static boolean putUnique(Map<String, Object> row, String key, Object value) {
        if (row.containsKey(key)) {
            return false;
        }
        row.put(key, value);
        return true;
    }

    /**
     * Converts a JSON value to a table cell: scalars to Java values, containers to JSON text.
     */
    static Object cell(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            return value.numberValue();
        }
        if (value.isContainerNode()) {
            return value.toString();
        }
        return value.asText();
    }

    private static String textOf(JsonNode node) {
        return node.isTextual() ? node.textValue() : node.toString();
    }

    private static boolean isMapping(JsonNode node) {
        return node != null && node.isObject();
    }

    private static boolean isScalar(JsonNode node) {
        return node == null || node.isValueNode();
    }
}
