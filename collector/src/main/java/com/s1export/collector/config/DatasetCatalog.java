package com.s1export.collector.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The dataset catalog: which datasets exist, where they live, and how fast they may be read.
 * Loaded from the {@code datasets.json} classpath resource unless a file is given.
 */
public class DatasetCatalog {

    private static final Logger logger = LoggerFactory.getLogger(DatasetCatalog.class);

    public static final String DEFAULT_RESOURCE = "/datasets.json";
    static final double GLOBAL_DEFAULT_RATE = 1.0;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final List<String> apiVersions;
    private final double defaultRequestsPerSecond;
    private final Map<String, Double> rateLimits;
    private final List<DatasetDescriptor> datasets;

    public DatasetCatalog(List<String> apiVersions, double defaultRequestsPerSecond,
                          Map<String, Double> rateLimits, List<DatasetDescriptor> datasets) {
        if (!(defaultRequestsPerSecond > 0)) {
            throw new IllegalArgumentException("defaultRequestsPerSecond must be positive: "
                    + defaultRequestsPerSecond);
        }
        if (apiVersions == null || apiVersions.isEmpty()) {
            throw new IllegalArgumentException("Catalog defines no apiVersions");
        }
        Set<String> names = new HashSet<>();
        for (DatasetDescriptor descriptor : datasets) {
            if (!names.add(descriptor.name())) {
                throw new IllegalArgumentException("Duplicate dataset name in catalog: " + descriptor.name());
            }
        }
        rateLimits.forEach((path, rate) -> {
            if (rate == null || !(rate > 0)) {
                throw new IllegalArgumentException("Rate limit for " + path + " must be positive: " + rate);
            }
        });
        this.apiVersions = List.copyOf(apiVersions);
        this.defaultRequestsPerSecond = defaultRequestsPerSecond;
        this.rateLimits = Collections.unmodifiableMap(new LinkedHashMap<>(rateLimits));
        this.datasets = List.copyOf(datasets);
    }

    /**
     * Loads the catalog bundled with the collector.
     */
    public static DatasetCatalog loadDefault() throws IOException {
        try (InputStream in = DatasetCatalog.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IOException("Catalog resource not found on classpath: " + DEFAULT_RESOURCE);
            }
            return parse(MAPPER.readValue(in, CatalogDocument.class), DEFAULT_RESOURCE);
        }
    }

    /**
     * Loads a catalog from a JSON file.
     */
    public static DatasetCatalog load(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return parse(MAPPER.readValue(in, CatalogDocument.class), file.toString());
        }
    }

    static DatasetCatalog parse(CatalogDocument document, String source) {
        if (document.datasets() == null || document.datasets().isEmpty()) {
            throw new IllegalArgumentException("Catalog " + source + " defines no datasets");
        }
        if (document.apiVersions() != null && document.apiVersions().isEmpty()) {
            throw new IllegalArgumentException("Catalog " + source + " defines no apiVersions");
        }
        List<DatasetDescriptor> descriptors = new ArrayList<>();
        for (CatalogEntry entry : document.datasets()) {
            descriptors.add(new DatasetDescriptor(entry.name(), entry.primaryPath(),
                    entry.alternatePaths(), entry.params(), entry.paginate(), entry.rateLimit(),
                    entry.outputName()));
        }
        DatasetCatalog catalog = new DatasetCatalog(
                document.apiVersions() != null ? document.apiVersions() : List.of(""),
                document.defaultRequestsPerSecond() != null
                        ? document.defaultRequestsPerSecond() : GLOBAL_DEFAULT_RATE,
                document.rateLimits() != null ? document.rateLimits() : Map.of(),
                descriptors);
        logger.info("Loaded {} datasets from catalog {}", descriptors.size(), source);
        return catalog;
    }

    public List<String> apiVersions() {
        return apiVersions;
    }

    public double defaultRequestsPerSecond() {
        return defaultRequestsPerSecond;
    }

    public Map<String, Double> rateLimits() {
        return rateLimits;
    }

    public List<DatasetDescriptor> datasets() {
        return datasets;
    }

    public List<String> names() {
        return datasets.stream().map(DatasetDescriptor::name).toList();
    }

    public Optional<DatasetDescriptor> find(String name) {
        return datasets.stream().filter(d -> d.name().equals(name)).findFirst();
    }

    /**
     * Builds the base URLs to call: the pinned URL alone when one is configured,
     * otherwise the console URL combined with every API version in catalog order.
     */
    public ApiTarget resolveTarget(AppConfig config) {
        if (config.isBaseUrlPinned()) {
            return ApiTarget.pinned(config.getPinnedBaseUrl());
        }
        List<String> bases = apiVersions.stream()
                .map(version -> config.getConsoleUrl() + version)
                .toList();
        return new ApiTarget(bases.get(0), bases.subList(1, bases.size()), false);
    }

    // -------------------------------------------------------------------------
    // JSON document shape
    // -------------------------------------------------------------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CatalogDocument(
            @JsonProperty("apiVersions") List<String> apiVersions,
            @JsonProperty("defaultRequestsPerSecond") Double defaultRequestsPerSecond,
            @JsonProperty("rateLimits") Map<String, Double> rateLimits,
            @JsonProperty("datasets") List<CatalogEntry> datasets
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CatalogEntry(
            @JsonProperty("name") String name,
            @JsonProperty("primaryPath") String primaryPath,
            @JsonProperty("alternatePaths") List<String> alternatePaths,
            @JsonProperty("params") Map<String, Object> params,
            @JsonProperty("paginate") boolean paginate,
            @JsonProperty("rateLimit") Double rateLimit,
            @JsonProperty("outputName") String outputName
    ) {}
}
