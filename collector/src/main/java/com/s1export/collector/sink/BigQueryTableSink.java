package com.s1export.collector.sink;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryError;
import com.google.cloud.bigquery.BigQueryOptions;
import com.google.cloud.bigquery.DatasetId;
import com.google.cloud.bigquery.DatasetInfo;
import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.InsertAllRequest;
import com.google.cloud.bigquery.InsertAllResponse;
import com.google.cloud.bigquery.Schema;
import com.google.cloud.bigquery.StandardSQLTypeName;
import com.google.cloud.bigquery.StandardTableDefinition;
import com.google.cloud.bigquery.Table;
import com.google.cloud.bigquery.TableId;
import com.google.cloud.bigquery.TableInfo;
import com.s1export.collector.normalize.TabularDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * BigQuery writer that streams each dataset into its own table of the
 * {@code sentinelone_raw} dataset. Tables are created on first use with one nullable
 * STRING column per table column plus {@code ingestion_timestamp}; columns seen later
 * are appended to the schema. Empty tables are skipped.
 */
public class BigQueryTableSink implements TableSink {

    private static final Logger logger = LoggerFactory.getLogger(BigQueryTableSink.class);

    static final String RAW_DATASET = "sentinelone_raw";
    static final String INGESTION_TIMESTAMP = "ingestion_timestamp";

    private final BigQuery bigQuery;
    private final String projectId;

    /**
     * Production constructor. Initializes BigQuery client using service account
     * credentials from GOOGLE_APPLICATION_CREDENTIALS environment variable.
     */
    public BigQueryTableSink(String projectId) {
        this(BigQueryOptions.newBuilder()
                .setProjectId(projectId)
                .build()
                .getService(), projectId);
        logger.info("BigQueryTableSink initialized for project: {}", projectId);
    }

    /**
     * Test constructor. Accepts an injected BigQuery client for mocking.
     */
    BigQueryTableSink(BigQuery bigQuery, String projectId) {
        this.bigQuery = bigQuery;
        this.projectId = projectId;
    }

    @Override
    public SinkResult write(TabularDataset table, String datasetName) {
        String tableName = columnName(datasetName);
        String destination = RAW_DATASET + "." + tableName;

        if (table.isEmpty()) {
            logger.info("[{}] Empty table; nothing to stream into {}", datasetName, destination);
            return SinkResult.skipped(destination);
        }

        ensureDatasetExists();
        Map<String, String> columnNames = columnNames(table.columns());
        TableId tableId = TableId.of(projectId, RAW_DATASET, tableName);
        ensureTableHasColumns(tableId, columnNames.values());

        String now = Instant.now().toString();
        InsertAllRequest.Builder requestBuilder = InsertAllRequest.newBuilder(tableId);
        for (Map<String, Object> row : table.rows()) {
            Map<String, Object> content = new HashMap<>();
            row.forEach((column, value) -> {
                if (value != null) {
                    content.put(columnNames.get(column), String.valueOf(value));
                }
            });
            content.put(INGESTION_TIMESTAMP, now);
            requestBuilder.addRow(content);
        }

        InsertAllResponse response = bigQuery.insertAll(requestBuilder.build());

        List<SinkResult.RowError> errors = new ArrayList<>();
        if (response.hasErrors()) {
            for (Map.Entry<Long, List<BigQueryError>> entry : response.getInsertErrors().entrySet()) {
                long rowIndex = entry.getKey();
                for (BigQueryError error : entry.getValue()) {
                    errors.add(new SinkResult.RowError(rowIndex, error.getMessage()));
                    logger.error("Insert error in {} row {}: {} (reason: {})",
                            destination, rowIndex, error.getMessage(), error.getReason());
                }
            }
        }

        int writtenRows = table.rowCount() - response.getInsertErrors().size();
        logger.info("Inserted {}/{} rows into {} ({} errors)",
                writtenRows, table.rowCount(), destination, errors.size());
        return new SinkResult(destination, table.rowCount(), writtenRows, errors, false);
    }

    private void ensureDatasetExists() {
        DatasetId datasetId = DatasetId.of(projectId, RAW_DATASET);
        if (bigQuery.getDataset(datasetId) == null) {
            bigQuery.create(DatasetInfo.newBuilder(datasetId).setLocation("US").build());
            logger.info("Created dataset: {}", RAW_DATASET);
        }
    }

    private void ensureTableHasColumns(TableId tableId, Iterable<String> columns) {
        Table existing = bigQuery.getTable(tableId);
        if (existing == null) {
            List<Field> fields = new ArrayList<>();
            columns.forEach(column -> fields.add(stringField(column)));
            fields.add(Field.newBuilder(INGESTION_TIMESTAMP, StandardSQLTypeName.TIMESTAMP)
                    .setMode(Field.Mode.REQUIRED).build());
            bigQuery.create(TableInfo.newBuilder(tableId,
                    StandardTableDefinition.of(Schema.of(fields))).build());
            logger.info("Created table: {}.{} with {} columns", RAW_DATASET, tableId.getTable(), fields.size());
            return;
        }

        Schema schema = existing.getDefinition().getSchema();
        List<Field> fields = schema != null ? new ArrayList<>(schema.getFields()) : new ArrayList<>();
        Set<String> known = new LinkedHashSet<>();
        fields.forEach(field -> known.add(field.getName()));

        int before = fields.size();
        for (String column : columns) {
            if (!known.contains(column)) {
                fields.add(stringField(column));
            }
        }
        if (fields.size() > before) {
            bigQuery.update(existing.toBuilder()
                    .setDefinition(StandardTableDefinition.of(Schema.of(fields)))
                    .build());
            logger.info("Added {} columns to {}.{}", fields.size() - before, RAW_DATASET, tableId.getTable());
        }
    }

    private static Field stringField(String column) {
        return Field.newBuilder(column, StandardSQLTypeName.STRING).setMode(Field.Mode.NULLABLE).build();
    }

    /**
     * Maps table columns to unique BigQuery-legal column names.
     */
    static Map<String, String> columnNames(List<String> columns) {
        Map<String, String> names = new LinkedHashMap<>();
        Set<String> used = new LinkedHashSet<>();
        used.add(INGESTION_TIMESTAMP);
        for (String column : columns) {
            String base = columnName(column);
            String candidate = base;
            for (int suffix = 2; used.contains(candidate); suffix++) {
                candidate = base + "_" + suffix;
            }
            used.add(candidate);
            names.put(column, candidate);
        }
        return names;
    }

    static String columnName(String name) {
        String sanitized = name.replaceAll("[^A-Za-z0-9_]", "_");
        if (sanitized.isEmpty() || Character.isDigit(sanitized.charAt(0))) {
            sanitized = "_" + sanitized;
        }
        return sanitized;
    }
}
