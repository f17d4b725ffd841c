package com.s1export.collector.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.function.Function;

/**
 * Configuration management class that reads environment variables
 * and .env file settings using dotenv-java. Validates required
 * variables on startup.
 */
public class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);

    public static final String DEFAULT_CONSOLE_URL = "https://usea1-012.sentinelone.net";
    public static final String DEFAULT_OUTPUT_DIR = "data_output";
    public static final long DEFAULT_MIN_PAGE_INTERVAL_MS = 200;

    public enum SinkType { CSV, BIGQUERY }

    private final String apiToken;
    private final String consoleUrl;
    private final String pinnedBaseUrl;
    private final String outputDir;
    private final SinkType sinkType;
    private final String gcpProjectId;
    private final Duration minPageInterval;
    private final boolean writeEmptyTables;

    public AppConfig() {
        this(dotenvLookup(Dotenv.configure().ignoreIfMissing().load()));
    }

    /**
     * Constructor for testing. Accepts a key lookup in place of the environment.
     */
    public AppConfig(Function<String, String> lookup) {
        this.apiToken = firstNonBlank(lookup.apply("API_TOKEN"), lookup.apply("SENTINEL_API_TOKEN"));
        this.consoleUrl = stripTrailingSlash(orDefault(lookup.apply("SENTINEL_CONSOLE_URL"), DEFAULT_CONSOLE_URL));
        this.pinnedBaseUrl = isBlank(lookup.apply("SENTINEL_BASE_URL"))
                ? null : stripTrailingSlash(lookup.apply("SENTINEL_BASE_URL"));
        this.outputDir = orDefault(lookup.apply("OUTPUT_DIR"), DEFAULT_OUTPUT_DIR);
        this.sinkType = parseSinkType(lookup.apply("OUTPUT_SINK"));
        this.gcpProjectId = lookup.apply("GCP_PROJECT_ID");
        this.minPageInterval = Duration.ofMillis(parseLong("MIN_PAGE_INTERVAL_MS",
                lookup.apply("MIN_PAGE_INTERVAL_MS"), DEFAULT_MIN_PAGE_INTERVAL_MS));
        this.writeEmptyTables = isBlank(lookup.apply("WRITE_EMPTY_TABLES"))
                || Boolean.parseBoolean(lookup.apply("WRITE_EMPTY_TABLES").trim());

        validate();

        logger.info("Configuration loaded: consoleUrl={}, pinnedBaseUrl={}, outputDir={}, sink={}",
                consoleUrl, pinnedBaseUrl != null ? pinnedBaseUrl : "none", outputDir, sinkType);
    }

    private void validate() {
        StringBuilder missing = new StringBuilder();
        if (isBlank(apiToken)) missing.append("API_TOKEN (or SENTINEL_API_TOKEN) ");
        if (sinkType == SinkType.BIGQUERY && isBlank(gcpProjectId)) missing.append("GCP_PROJECT_ID ");

        if (!missing.isEmpty()) {
            throw new IllegalStateException(
                    "Missing required environment variables: " + missing.toString().trim());
        }
    }

    private static Function<String, String> dotenvLookup(Dotenv dotenv) {
        return key -> {
            String envValue = System.getenv(key);
            if (envValue != null && !envValue.isBlank()) {
                return envValue;
            }
            return dotenv.get(key);
        };
    }

    private static SinkType parseSinkType(String value) {
        if (isBlank(value)) {
            return SinkType.CSV;
        }
        try {
            return SinkType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Unsupported OUTPUT_SINK: " + value + " (expected csv or bigquery)", e);
        }
    }

    private static long parseLong(String key, String value, long defaultValue) {
        if (isBlank(value)) {
            return defaultValue;
        }
        try {
            long parsed = Long.parseLong(value.trim());
            if (parsed < 0) {
                throw new IllegalStateException(key + " must not be negative: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalStateException(key + " is not a number: " + value, e);
        }
    }

    private static String firstNonBlank(String first, String second) {
        return !isBlank(first) ? first.trim() : (!isBlank(second) ? second.trim() : null);
    }

    private static String orDefault(String value, String defaultValue) {
        return isBlank(value) ? defaultValue : value.trim();
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public String getApiToken() {
        return apiToken;
    }

    public String getConsoleUrl() {
        return consoleUrl;
    }

    /**
     * @return the explicitly configured base URL, or {@code null} when the console URL
     *         plus catalog API versions decide the base
     */
    public String getPinnedBaseUrl() {
        return pinnedBaseUrl;
    }

    public boolean isBaseUrlPinned() {
        return pinnedBaseUrl != null;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public SinkType getSinkType() {
        return sinkType;
    }

    public String getGcpProjectId() {
        return gcpProjectId;
    }

    public Duration getMinPageInterval() {
        return minPageInterval;
    }

    public boolean isWriteEmptyTables() {
        return writeEmptyTables;
    }
}
