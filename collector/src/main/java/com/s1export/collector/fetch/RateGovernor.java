package com.s1export.collector.fetch;

import com.s1export.collector.config.DatasetCatalog;
import com.s1export.collector.config.DatasetDescriptor;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns requests-per-second settings into the delay between two requests.
 *
 * <p>Lookup order: the dataset's own rate, then the longest entry of the path rate
 * table contained in the dataset's primary path, then the default rate. The governor
 * itself is stateless; escalation after a 429 lives in the {@link Throttle} it hands out
 * for a single dataset's retrieval.</p>
 */
public class RateGovernor {

    private final Map<String, Double> pathRates;
    private final double defaultRate;

    public RateGovernor(Map<String, Double> pathRates, double defaultRate) {
        if (!(defaultRate > 0)) {
            throw new IllegalArgumentException("Default rate must be positive: " + defaultRate);
        }
        this.pathRates = new LinkedHashMap<>(pathRates);
        this.defaultRate = defaultRate;
    }

    public static RateGovernor from(DatasetCatalog catalog) {
        return new RateGovernor(catalog.rateLimits(), catalog.defaultRequestsPerSecond());
    }

    public Duration delayFor(DatasetDescriptor descriptor) {
        return delayFor(descriptor.primaryPath(), descriptor.rateLimit());
    }

    /**
     * @param path           the dataset's primary path, matched against the rate table
     * @param configuredRate per-dataset requests per second, or {@code null}
     */
    public Duration delayFor(String path, Double configuredRate) {
        if (configuredRate != null && configuredRate > 0) {
            return toDelay(configuredRate);
        }
        String bestMatch = null;
        for (String key : pathRates.keySet()) {
            if (path.contains(key) && (bestMatch == null || key.length() > bestMatch.length())) {
                bestMatch = key;
            }
        }
        return toDelay(bestMatch != null ? pathRates.get(bestMatch) : defaultRate);
    }

    /**
     * Starts a fresh throttle for one dataset's retrieval.
     */
    public Throttle throttleFor(DatasetDescriptor descriptor, Duration maxDelay) {
        return new Throttle(delayFor(descriptor), maxDelay);
    }

    static Duration toDelay(double requestsPerSecond) {
        return Duration.ofNanos(Math.round(1_000_000_000d / requestsPerSecond));
    }
}
