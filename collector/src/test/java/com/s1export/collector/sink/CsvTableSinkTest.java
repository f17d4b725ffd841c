package com.s1export.collector.sink;

import com.opencsv.CSVReader;
import com.s1export.collector.normalize.NormalizationStrategy;
import com.s1export.collector.normalize.TabularDataset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link CsvTableSink} against a temporary output directory.
 */
class CsvTableSinkTest {

    @TempDir
    Path outputDir;

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    private List<String[]> readAll(Path file) throws Exception {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVReader csv = new CSVReader(reader)) {
            return csv.readAll();
        }
    }

    @Test
    @DisplayName("Writes header then rows, with missing and null cells empty")
    void write_headerAndRows() throws Exception {
        TabularDataset table = TabularDataset.of("agents", List.of(
                row("id", "1", "os", "windows", "active", true),
                row("id", "2", "cores", 8, "os", null)), NormalizationStrategy.FLATTENED);

        SinkResult result = new CsvTableSink(outputDir, true).write(table, "agents");

        Path file = outputDir.resolve("sentinelone_agents.csv");
        assertEquals(file.toString(), result.destination());
        assertEquals(2, result.writtenRows());
        assertFalse(result.skipped());

        List<String[]> lines = readAll(file);
        assertEquals(3, lines.size());
        assertArrayEquals(new String[]{"id", "os", "active", "cores"}, lines.get(0));
        assertArrayEquals(new String[]{"1", "windows", "true", ""}, lines.get(1));
        assertArrayEquals(new String[]{"2", "", "", "8"}, lines.get(2));
    }

    @Test
    @DisplayName("Quotes values containing separators and newlines")
    void write_escapesSpecialCharacters() throws Exception {
        TabularDataset table = TabularDataset.of("rules", List.of(
                row("name", "a, \"b\"", "query", "line1\nline2")), NormalizationStrategy.FLATTENED);

        new CsvTableSink(outputDir, true).write(table, "rules");

        List<String[]> lines = readAll(outputDir.resolve("sentinelone_rules.csv"));
        assertArrayEquals(new String[]{"a, \"b\"", "line1\nline2"}, lines.get(1));
    }

    @Test
    @DisplayName("Empty table is written as an empty file by default")
    void emptyTable_writtenEmpty() throws Exception {
        SinkResult result = new CsvTableSink(outputDir, true).write(TabularDataset.empty("alerts"), "alerts");

        Path file = outputDir.resolve("sentinelone_alerts.csv");
        assertTrue(Files.exists(file));
        assertEquals(0, Files.size(file));
        assertEquals(0, result.writtenRows());
        assertFalse(result.skipped());
    }

    @Test
    @DisplayName("Empty table is skipped when empty tables are disabled")
    void emptyTable_skipped() throws Exception {
        SinkResult result = new CsvTableSink(outputDir, false).write(TabularDataset.empty("alerts"), "alerts");

        assertTrue(result.skipped());
        assertFalse(Files.exists(outputDir.resolve("sentinelone_alerts.csv")));
    }

    @Test
    @DisplayName("Creates the output directory when missing")
    void write_createsOutputDirectory() throws Exception {
        Path nested = outputDir.resolve("run/1");
        TabularDataset table = TabularDataset.of("sites", List.of(row("id", "1")), NormalizationStrategy.FLATTENED);

        new CsvTableSink(nested, true).write(table, "sites");

        assertTrue(Files.exists(nested.resolve("sentinelone_sites.csv")));
    }

    @Test
    @DisplayName("File names replace characters outside letters, digits and underscore")
    void fileNameFor_sanitizes() {
        assertEquals("sentinelone_deployment_packs.csv", CsvTableSink.fileNameFor("deployment-packs"));
        assertEquals("sentinelone_api_tokens.csv", CsvTableSink.fileNameFor("api-tokens"));
    }
}
