package com.s1export.collector.sink;

import com.opencsv.CSVWriter;
import com.s1export.collector.normalize.TabularDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Writes each dataset to {@code sentinelone_<name>.csv} in the output directory,
 * header row first. Missing and null cells are written empty.
 */
public class CsvTableSink implements TableSink {

    private static final Logger logger = LoggerFactory.getLogger(CsvTableSink.class);

    static final String FILE_PREFIX = "sentinelone_";

    private final Path outputDir;
    private final boolean writeEmptyTables;

    public CsvTableSink(Path outputDir, boolean writeEmptyTables) {
        this.outputDir = outputDir;
        this.writeEmptyTables = writeEmptyTables;
    }

    @Override
    public SinkResult write(TabularDataset table, String datasetName) throws IOException {
        Path file = outputDir.resolve(fileNameFor(datasetName));

        if (table.isEmpty() && !writeEmptyTables) {
            logger.info("[{}] Empty table; not writing {}", datasetName, file);
            return SinkResult.skipped(file.toString());
        }

        Files.createDirectories(outputDir);
        List<String> columns = table.columns();
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVWriter csv = new CSVWriter(writer)) {
            if (!columns.isEmpty()) {
                csv.writeNext(columns.toArray(new String[0]), false);
            }
            for (Map<String, Object> row : table.rows()) {
                String[] cells = new String[columns.size()];
                for (int i = 0; i < cells.length; i++) {
                    cells[i] = format(row.get(columns.get(i)));
                }
                csv.writeNext(cells, false);
            }
        }

        logger.info("[{}] Wrote {} rows x {} columns to {}",
                datasetName, table.rowCount(), columns.size(), file);
        return SinkResult.written(file.toString(), table.rowCount());
    }

    static String fileNameFor(String datasetName) {
        return FILE_PREFIX + datasetName.replaceAll("[^A-Za-z0-9_]", "_") + ".csv";
    }

    private static String format(Object value) {
        return value == null ? "" : String.valueOf(value);
    }
}
