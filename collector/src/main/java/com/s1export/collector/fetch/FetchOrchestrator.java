package com.s1export.collector.fetch;

import com.s1export.collector.client.TransportClient;
import com.s1export.collector.config.ApiTarget;
import com.s1export.collector.config.DatasetDescriptor;
import com.s1export.collector.config.FetchSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Fetches one dataset by walking its endpoint candidates until one of them yields records.
 *
 * <p>A candidate that is missing or keeps failing hands over to the next one. A rejected
 * credential or an unreadable payload ends the dataset immediately. A single
 * {@link Throttle} is created per call and shared by that dataset's candidates only.</p>
 */
public class FetchOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(FetchOrchestrator.class);

    private final EndpointResolver resolver;
    private final PaginatedRetriever retriever;
    private final RateGovernor rateGovernor;
    private final FetchSettings settings;

    public FetchOrchestrator(TransportClient transport, ApiTarget target, RateGovernor rateGovernor,
                             FetchSettings settings, Sleeper sleeper) {
        this(new EndpointResolver(target), new PaginatedRetriever(transport, settings, sleeper),
                rateGovernor, settings);
    }

    // Visible for testing
    FetchOrchestrator(EndpointResolver resolver, PaginatedRetriever retriever,
                      RateGovernor rateGovernor, FetchSettings settings) {
        this.resolver = resolver;
        this.retriever = retriever;
        this.rateGovernor = rateGovernor;
        this.settings = settings;
    }

    public FetchOutcome fetch(DatasetDescriptor descriptor) throws InterruptedException {
        List<EndpointCandidate> candidates = resolver.candidates(descriptor);
        Throttle throttle = rateGovernor.throttleFor(descriptor, settings.maxThrottleDelay());
        logger.info("[{}] Fetching with {} candidate endpoint(s), request delay {}ms",
                descriptor.name(), candidates.size(), throttle.currentDelay().toMillis());

        int attempted = 0;
        RetrievalResult last = null;
        for (EndpointCandidate candidate : candidates) {
            attempted++;
            last = retriever.retrieve(descriptor, candidate, throttle);

            if (last.status().abortsDataset()) {
                logger.error("[{}] Aborting after {} ({}); remaining candidates skipped",
                        descriptor.name(), last.status(), last.reason());
                return FetchOutcome.none(attempted, last.status(), last.reason());
            }
            if (last.status().isSuccess() && last.hasRecords()) {
                logger.info("[{}] Retrieved {} records from {} ({} page(s))",
                        descriptor.name(), last.records().size(), candidate, last.pagesFetched());
                return FetchOutcome.found(last, attempted);
            }
            if (last.status().isSuccess()) {
                logger.info("[{}] {} returned no records; trying next candidate", descriptor.name(), candidate);
            } else {
                logger.warn("[{}] {} failed ({}: {}); trying next candidate",
                        descriptor.name(), candidate, last.status(), last.reason());
            }
        }

        logger.warn("[{}] No data from any of {} candidate endpoint(s)", descriptor.name(), attempted);
        return last == null
                ? FetchOutcome.none(0, null, "no candidates")
                : FetchOutcome.none(attempted, last.status(), last.reason());
    }
}
