package com.s1export.collector.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link AppConfig} defaults and validation logic.
 */
class AppConfigTest {

    private static AppConfig configOf(Map<String, String> env) {
        return new AppConfig(env::get);
    }

    @Test
    @DisplayName("Applies defaults when only the token is set")
    void defaults() {
        AppConfig config = configOf(Map.of("API_TOKEN", "tok"));

        assertEquals("tok", config.getApiToken());
        assertEquals(AppConfig.DEFAULT_CONSOLE_URL, config.getConsoleUrl());
        assertFalse(config.isBaseUrlPinned());
        assertNull(config.getPinnedBaseUrl());
        assertEquals("data_output", config.getOutputDir());
        assertEquals(AppConfig.SinkType.CSV, config.getSinkType());
        assertEquals(Duration.ofMillis(200), config.getMinPageInterval());
        assertTrue(config.isWriteEmptyTables());
    }

    @Test
    @DisplayName("SENTINEL_API_TOKEN is accepted when API_TOKEN is absent")
    void alternateTokenVariable() {
        AppConfig config = configOf(Map.of("SENTINEL_API_TOKEN", "s1-tok"));

        assertEquals("s1-tok", config.getApiToken());
    }

    @Test
    @DisplayName("Reads every optional setting")
    void allSettings() {
        Map<String, String> env = new HashMap<>();
        env.put("API_TOKEN", "tok");
        env.put("SENTINEL_CONSOLE_URL", "https://eu1.sentinelone.net/");
        env.put("SENTINEL_BASE_URL", "https://eu1.sentinelone.net/web/api/v2.0/");
        env.put("OUTPUT_DIR", "/tmp/out");
        env.put("OUTPUT_SINK", "BigQuery");
        env.put("GCP_PROJECT_ID", "my-project");
        env.put("MIN_PAGE_INTERVAL_MS", "0");
        env.put("WRITE_EMPTY_TABLES", "false");

        AppConfig config = configOf(env);

        assertEquals("https://eu1.sentinelone.net", config.getConsoleUrl());
        assertTrue(config.isBaseUrlPinned());
        assertEquals("https://eu1.sentinelone.net/web/api/v2.0", config.getPinnedBaseUrl());
        assertEquals("/tmp/out", config.getOutputDir());
        assertEquals(AppConfig.SinkType.BIGQUERY, config.getSinkType());
        assertEquals("my-project", config.getGcpProjectId());
        assertEquals(Duration.ZERO, config.getMinPageInterval());
        assertFalse(config.isWriteEmptyTables());
    }

    @Test
    @DisplayName("Throws when API_TOKEN is missing")
    void missingToken_throws() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> configOf(Map.of("API_TOKEN", "  ")));

        assertTrue(ex.getMessage().contains("API_TOKEN"));
    }

    @Test
    @DisplayName("BigQuery sink requires GCP_PROJECT_ID")
    void bigQueryWithoutProject_throws() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> configOf(Map.of("API_TOKEN", "tok", "OUTPUT_SINK", "bigquery")));

        assertTrue(ex.getMessage().contains("GCP_PROJECT_ID"));
    }

    @Test
    @DisplayName("Throws with all missing vars listed in message")
    void allMissing_listsAllVars() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> configOf(Map.of("OUTPUT_SINK", "bigquery")));

        String msg = ex.getMessage();
        assertTrue(msg.contains("API_TOKEN"));
        assertTrue(msg.contains("GCP_PROJECT_ID"));
    }

    @Test
    @DisplayName("Rejects unknown sink and malformed interval")
    void invalidValues_throw() {
        assertThrows(IllegalStateException.class,
                () -> configOf(Map.of("API_TOKEN", "tok", "OUTPUT_SINK", "parquet")));
        assertThrows(IllegalStateException.class,
                () -> configOf(Map.of("API_TOKEN", "tok", "MIN_PAGE_INTERVAL_MS", "fast")));
        assertThrows(IllegalStateException.class,
                () -> configOf(Map.of("API_TOKEN", "tok", "MIN_PAGE_INTERVAL_MS", "-1")));
    }
}
