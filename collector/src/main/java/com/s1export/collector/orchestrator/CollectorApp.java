package com.s1export.collector.orchestrator;

import com.s1export.collector.client.OkHttpTransportClient;
import com.s1export.collector.config.ApiTarget;
import com.s1export.collector.config.AppConfig;
import com.s1export.collector.config.DatasetCatalog;
import com.s1export.collector.config.DatasetDescriptor;
import com.s1export.collector.config.FetchSettings;
import com.s1export.collector.fetch.FetchOrchestrator;
import com.s1export.collector.fetch.RateGovernor;
import com.s1export.collector.fetch.Sleeper;
import com.s1export.collector.normalize.SchemaNormalizer;
import com.s1export.collector.sink.BigQueryTableSink;
import com.s1export.collector.sink.CsvTableSink;
import com.s1export.collector.sink.TableSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Main entry point for the SentinelOne data collector.
 * Parses CLI arguments, initializes components, runs the collection pipeline,
 * and exits with appropriate status codes.
 *
 * <p>Usage:
 * <pre>
 *   java -jar collector.jar                              # every dataset in the catalog
 *   java -jar collector.jar --endpoints agents sites     # selected datasets only
 *   java -jar collector.jar --output out --catalog my-datasets.json
 *   java -jar collector.jar --list                       # print dataset names
 * </pre>
 *
 * <p>Exits 0 once every selected dataset has been attempted, whatever their outcome;
 * 1 on configuration errors, when no known dataset was selected, or on an unexpected error.</p>
 */
public class CollectorApp {

    private static final Logger logger = LoggerFactory.getLogger(CollectorApp.class);

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        try {
            CliOptions options = parseArgs(args);
            DatasetCatalog catalog = options.catalogFile() != null
                    ? DatasetCatalog.load(Path.of(options.catalogFile()))
                    : DatasetCatalog.loadDefault();

            if (options.listOnly()) {
                catalog.names().forEach(System.out::println);
                return 0;
            }

            List<DatasetDescriptor> selected = selectDatasets(catalog, options.endpoints());
            if (selected.isEmpty()) {
                logger.error("No valid datasets selected. Available: {}", String.join(", ", catalog.names()));
                return 1;
            }

            AppConfig config = new AppConfig();
            String outputDir = options.outputDir() != null ? options.outputDir() : config.getOutputDir();
            logger.info("Starting SentinelOne collection of {} dataset(s) into {}", selected.size(), outputDir);

            CollectionOrchestrator orchestrator = new CollectionOrchestrator(
                    buildFetchOrchestrator(config, catalog), new SchemaNormalizer(), buildSink(config, outputDir));
            CollectionSummary summary = orchestrator.run(selected);

            printSummary(summary);
            logger.info("SentinelOne collector finished: {}", summary.headline());
            return 0;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Collection interrupted", e);
            return 1;
        } catch (Exception e) {
            logger.error("Fatal error during collection", e);
            return 1;
        }
    }

    static FetchOrchestrator buildFetchOrchestrator(AppConfig config, DatasetCatalog catalog) {
        ApiTarget target = catalog.resolveTarget(config);
        logger.info("Primary base URL: {} (fallbacks: {})", target.primaryBaseUrl(),
                target.pinned() ? "none, base URL pinned" : target.fallbackBaseUrls());
        return new FetchOrchestrator(new OkHttpTransportClient(config.getApiToken()), target,
                RateGovernor.from(catalog), FetchSettings.defaults(config.getMinPageInterval()), Sleeper.SYSTEM);
    }

    static TableSink buildSink(AppConfig config, String outputDir) {
        return switch (config.getSinkType()) {
            case CSV -> new CsvTableSink(Path.of(outputDir), config.isWriteEmptyTables());
            case BIGQUERY -> new BigQueryTableSink(config.getGcpProjectId());
        };
    }

    /**
     * Picks the requested datasets in catalog order; every dataset when none was requested.
     * Unknown names are logged and skipped.
     */
    static List<DatasetDescriptor> selectDatasets(DatasetCatalog catalog, List<String> requested) {
        if (requested.isEmpty()) {
            return catalog.datasets();
        }
        Set<String> wanted = new LinkedHashSet<>(requested);
        for (String name : wanted) {
            if (catalog.find(name).isEmpty()) {
                logger.warn("Unknown dataset '{}' ignored", name);
            }
        }
        return catalog.datasets().stream()
                .filter(d -> wanted.contains(d.name()))
                .toList();
    }

    static CliOptions parseArgs(String[] args) {
        List<String> endpoints = new ArrayList<>();
        String outputDir = null;
        String catalogFile = null;
        boolean listOnly = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--endpoints" -> {
                    int before = endpoints.size();
                    while (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                        for (String name : args[++i].split(",")) {
                            if (!name.isBlank()) {
                                endpoints.add(name.trim());
                            }
                        }
                    }
                    if (endpoints.size() == before) {
                        throw new IllegalArgumentException(arg + " requires a value");
                    }
                }
                case "--output" -> outputDir = requireValue(args, ++i, arg);
                case "--catalog" -> catalogFile = requireValue(args, ++i, arg);
                case "--list" -> listOnly = true;
                default -> throw new IllegalArgumentException("Unknown argument: " + arg);
            }
        }
        return new CliOptions(endpoints, outputDir, catalogFile, listOnly);
    }

    private static String requireValue(String[] args, int index, String flag) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new IllegalArgumentException(flag + " requires a value");
        }
        return args[index];
    }

    record CliOptions(List<String> endpoints, String outputDir, String catalogFile, boolean listOnly) {}

    private static void printSummary(CollectionSummary summary) {
        System.out.println();
        System.out.println("=== SentinelOne Collection Summary ===");
        System.out.println("Duration: " + summary.totalDurationMs() + "ms");
        System.out.println();
        for (DatasetResult result : summary.results()) {
            if (result.success()) {
                System.out.printf("  ✅ %-18s records=%-7d source=%s%s%n", result.datasetName(),
                        result.recordCount(), result.provenance(), result.truncated() ? " (truncated)" : "");
            } else {
                System.out.printf("  ❌ %-18s %s%n", result.datasetName(), result.errorMessage());
            }
        }
        System.out.println();
        System.out.println(summary.headline());
        System.out.println();
    }
}
