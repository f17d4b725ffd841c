package com.s1export.collector.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link DatasetCatalog} loading, validation and base URL resolution.
 */
class DatasetCatalogTest {

    // =========================================================================
    // Bundled catalog
    // =========================================================================

    @Test
    @DisplayName("Bundled catalog lists the eight datasets in collection order")
    void loadDefault_eightDatasets() throws IOException {
        DatasetCatalog catalog = DatasetCatalog.loadDefault();

        assertEquals(List.of("sites", "policies", "exclusions", "deployment-packs",
                "agents", "rules", "alerts", "api-tokens"), catalog.names());
        assertEquals(List.of("/web/api/v2.1", "/web/api/v2.0"), catalog.apiVersions());
        assertEquals(1.0, catalog.defaultRequestsPerSecond());
    }

    @Test
    @DisplayName("Bundled catalog carries alternates, params and rate overrides")
    void loadDefault_descriptorDetails() throws IOException {
        DatasetCatalog catalog = DatasetCatalog.loadDefault();

        DatasetDescriptor alerts = catalog.find("alerts").orElseThrow();
        assertEquals("/alerts", alerts.primaryPath());
        assertEquals(List.of("/cloud-detection/alerts", "/threats"), alerts.alternatePaths());
        assertEquals(0.5, alerts.rateLimit());
        assertEquals(100, ((Number) alerts.params().get("limit")).intValue());

        DatasetDescriptor rules = catalog.find("rules").orElseThrow();
        assertEquals(List.of("/cloud-detection/rules", "/firewall-control"), rules.alternatePaths());

        assertTrue(catalog.find("nonexistent").isEmpty());
    }

    // =========================================================================
    // Validation
    // =========================================================================

    @Test
    @DisplayName("Rejects duplicate dataset names")
    void duplicateNames_rejected() {
        List<DatasetDescriptor> datasets = List.of(
                DatasetDescriptor.of("sites", "/sites"),
                DatasetDescriptor.of("sites", "/sites/v2"));

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> new DatasetCatalog(List.of(""), 1.0, Map.of(), datasets));

        assertTrue(ex.getMessage().contains("sites"));
    }

    @Test
    @DisplayName("Rejects non-positive rate table entries")
    void nonPositiveRate_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new DatasetCatalog(List.of(""), 1.0,
                Map.of("/agents", 0.0), List.of(DatasetDescriptor.of("agents", "/agents"))));
    }

    @Test
    @DisplayName("Rejects relative paths in descriptors")
    void relativePath_rejected() {
        assertThrows(IllegalArgumentException.class, () -> DatasetDescriptor.of("sites", "sites"));
        assertThrows(IllegalArgumentException.class, () -> new DatasetDescriptor("sites", "/sites",
                List.of("sites/alt"), Map.of(), false, null));
    }

    @Test
    @DisplayName("Rejects a catalog without API versions")
    void emptyApiVersions_rejected(@TempDir Path tempDir) throws IOException {
        assertThrows(IllegalArgumentException.class, () -> new DatasetCatalog(List.of(), 1.0,
                Map.of(), List.of(DatasetDescriptor.of("sites", "/sites"))));

        Path file = tempDir.resolve("no-versions.json");
        Files.writeString(file, """
                {"apiVersions": [],
                 "datasets": [{"name": "sites", "primaryPath": "/sites"}]}""");

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> DatasetCatalog.load(file));
        assertTrue(ex.getMessage().contains(file.toString()));
        assertTrue(ex.getMessage().contains("apiVersions"));
    }

    @Test
    @DisplayName("Output name overrides the dataset name for sinks")
    void outputName_overridesTableName() throws IOException {
        DatasetCatalog catalog = DatasetCatalog.loadDefault();

        assertEquals("deployments", catalog.find("deployment-packs").orElseThrow().tableName());
        assertEquals("api-tokens", catalog.find("api-tokens").orElseThrow().tableName());
        assertThrows(IllegalArgumentException.class, () -> new DatasetDescriptor("sites", "/sites",
                List.of(), Map.of(), false, null, " "));
    }

    @Test
    @DisplayName("Loads a catalog file and rejects one without datasets")
    void load_fromFile(@TempDir Path tempDir) throws IOException {
        Path good = tempDir.resolve("good.json");
        Files.writeString(good, """
                {"apiVersions": ["/web/api/v2.1"],
                 "datasets": [{"name": "sites", "primaryPath": "/sites", "paginate": true,
                               "params": {"limit": 1000}}]}""");
        Path empty = tempDir.resolve("empty.json");
        Files.writeString(empty, "{\"datasets\": []}");

        DatasetCatalog catalog = DatasetCatalog.load(good);

        assertEquals(List.of("sites"), catalog.names());
        assertTrue(catalog.datasets().get(0).paginate());
        assertEquals(1.0, catalog.defaultRequestsPerSecond());
        assertThrows(IllegalArgumentException.class, () -> DatasetCatalog.load(empty));
    }

    // =========================================================================
    // Base URL resolution
    // =========================================================================

    @Test
    @DisplayName("Unpinned target combines console URL with every API version")
    void resolveTarget_unpinned() throws IOException {
        AppConfig config = new AppConfig(Map.of("API_TOKEN", "tok",
                "SENTINEL_CONSOLE_URL", "https://console.test")::get);

        ApiTarget target = DatasetCatalog.loadDefault().resolveTarget(config);

        assertEquals("https://console.test/web/api/v2.1", target.primaryBaseUrl());
        assertEquals(List.of("https://console.test/web/api/v2.0"), target.fallbackBaseUrls());
        assertFalse(target.pinned());
    }

    @Test
    @DisplayName("Pinned base URL suppresses fallback bases")
    void resolveTarget_pinned() throws IOException {
        AppConfig config = new AppConfig(Map.of("API_TOKEN", "tok",
                "SENTINEL_BASE_URL", "https://console.test/web/api/v2.0")::get);

        ApiTarget target = DatasetCatalog.loadDefault().resolveTarget(config);

        assertEquals("https://console.test/web/api/v2.0", target.primaryBaseUrl());
        assertTrue(target.fallbackBaseUrls().isEmpty());
        assertTrue(target.pinned());
    }
}
