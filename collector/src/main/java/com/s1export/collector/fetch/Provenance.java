package com.s1export.collector.fetch;

/**
 * Which kind of endpoint candidate produced a dataset's records.
 */
public enum Provenance {
    PRIMARY,
    ALTERNATE,
    FALLBACK,
    NONE
}
