package com.s1export.collector.orchestrator;

import com.s1export.collector.config.DatasetDescriptor;
import com.s1export.collector.fetch.FetchOrchestrator;
import com.s1export.collector.fetch.FetchOutcome;
import com.s1export.collector.normalize.SchemaNormalizer;
import com.s1export.collector.normalize.TabularDataset;
import com.s1export.collector.sink.SinkResult;
import com.s1export.collector.sink.TableSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Coordinates the collection pipeline for each dataset in turn: fetch -> normalize -> write.
 * A dataset that fails is recorded in the summary and never stops the datasets after it.
 */
public class CollectionOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(CollectionOrchestrator.class);

    private final FetchOrchestrator fetchOrchestrator;
    private final SchemaNormalizer normalizer;
    private final TableSink sink;

    public CollectionOrchestrator(FetchOrchestrator fetchOrchestrator, SchemaNormalizer normalizer, TableSink sink) {
        this.fetchOrchestrator = fetchOrchestrator;
        this.normalizer = normalizer;
        this.sink = sink;
    }

    /**
     * Collects the given datasets sequentially, in the given order.
     *
     * @return summary of all dataset results
     * @throws InterruptedException if the thread is interrupted while waiting between requests
     */
    public CollectionSummary run(List<DatasetDescriptor> datasets) throws InterruptedException {
        Instant runStart = Instant.now();
        logger.info("Starting collection of {} datasets", datasets.size());

        List<DatasetResult> results = new ArrayList<>();
        for (DatasetDescriptor descriptor : datasets) {
            results.add(collect(descriptor));
        }

        CollectionSummary summary = new CollectionSummary(results, elapsed(runStart));
        logSummary(summary);
        return summary;
    }

    DatasetResult collect(DatasetDescriptor descriptor) throws InterruptedException {
        long stepStart = System.currentTimeMillis();
        String name = descriptor.name();
        try {
            FetchOutcome outcome = fetchOrchestrator.fetch(descriptor);
            TabularDataset table = normalizer.normalize(outcome.records(), name);
            SinkResult written = sink.write(table, descriptor.tableName());
            if (written.hasErrors()) {
                logger.warn("[{}] Write to {} had {} errors out of {} rows",
                        name, written.destination(), written.errors().size(), written.totalRows());
            }

            long duration = System.currentTimeMillis() - stepStart;
            if (!outcome.hasRecords()) {
                String reason = outcome.lastStatus() == null
                        ? "no data"
                        : "no data (" + outcome.lastStatus() + ": " + outcome.reason() + ")";
                return DatasetResult.noData(name, reason, written.destination(), duration, table);
            }
            return DatasetResult.success(name, outcome.recordCount(), written.writtenRows(),
                    outcome.provenance(), outcome.source().url(), written.destination(),
                    outcome.truncated(), duration, table);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        } catch (Exception e) {
            logger.error("Failed to collect {}", name, e);
            return DatasetResult.failure(name, e.getMessage(), System.currentTimeMillis() - stepStart);
        }
    }

    private void logSummary(CollectionSummary summary) {
        logger.info("=== Collection Summary ===");
        logger.info("Total duration: {}ms", summary.totalDurationMs());
        for (DatasetResult result : summary.results()) {
            if (result.success()) {
                logger.info("  ✅ {}: {} records from {} ({}){}", result.datasetName(), result.recordCount(),
                        result.sourceUrl(), result.provenance(), result.truncated() ? " [truncated]" : "");
            } else {
                logger.warn("  ❌ {}: {}", result.datasetName(), result.errorMessage());
            }
        }
        logger.info(summary.headline());
    }

    private long elapsed(Instant start) {
        return Instant.now().toEpochMilli() - start.toEpochMilli();
    }
}
