package com.s1export.collector.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One logical dataset of the management API: where to find it and how to page through it.
 * Immutable; built once from the catalog.
 *
 * @param name           unique key, also used to name the output table
 * @param primaryPath    path tried first, relative to a base URL
 * @param alternatePaths paths tried when the primary one is missing, in order
 * @param params         query parameters sent with every request (scalar values)
 * @param paginate       whether to follow {@code pagination.nextCursor}
 * @param rateLimit      requests per second override, or {@code null} to use the rate table
 * @param outputName     name of the output table when it differs from {@code name}, or {@code null}
 */
public record DatasetDescriptor(
        String name,
        String primaryPath,
        List<String> alternatePaths,
        Map<String, Object> params,
        boolean paginate,
        Double rateLimit,
        String outputName
) {

    public DatasetDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Dataset name must not be blank");
        }
        requireAbsolutePath(name, primaryPath);
        alternatePaths = alternatePaths == null ? List.of() : List.copyOf(alternatePaths);
        alternatePaths.forEach(path -> requireAbsolutePath(name, path));
        params = params == null ? Map.of() : unmodifiableCopy(params);
        if (rateLimit != null && !(rateLimit > 0)) {
            throw new IllegalArgumentException("Dataset " + name + " has a non-positive rateLimit: " + rateLimit);
        }
        if (outputName != null && outputName.isBlank()) {
            throw new IllegalArgumentException("Dataset " + name + " has a blank outputName");
        }
    }

    public DatasetDescriptor(String name, String primaryPath, List<String> alternatePaths,
                             Map<String, Object> params, boolean paginate, Double rateLimit) {
        this(name, primaryPath, alternatePaths, params, paginate, rateLimit, null);
    }

    public static DatasetDescriptor of(String name, String primaryPath) {
        return new DatasetDescriptor(name, primaryPath, List.of(), Map.of(), false, null);
    }

    /**
     * Name the sinks write this dataset under.
     */
    public String tableName() {
        return outputName != null ? outputName : name;
    }

    private static void requireAbsolutePath(String name, String path) {
        if (path == null || !path.startsWith("/")) {
            throw new IllegalArgumentException("Dataset " + name + " has an invalid path: " + path);
        }
    }

    private static Map<String, Object> unmodifiableCopy(Map<String, Object> params) {
        Map<String, Object> copy = new LinkedHashMap<>();
        params.forEach((key, value) -> copy.put(key, Objects.requireNonNull(value,
                () -> "Query parameter " + key + " has no value")));
        return Collections.unmodifiableMap(copy);
    }
}
