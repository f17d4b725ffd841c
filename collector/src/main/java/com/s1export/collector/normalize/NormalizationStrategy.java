package com.s1export.collector.normalize;

/**
 * Which step of the normalization ladder produced a table.
 */
public enum NormalizationStrategy {
    /** No records at all. */
    EMPTY,
    /** Mapping records with nested mappings expanded one level into {@code parent_child} columns. */
    FLATTENED,
    /** Top-level keys only; nested values kept as JSON text. */
    COLUMN_UNION,
    /** A list of scalars projected onto a single {@code value} column. */
    SCALAR_VALUES,
    /** Every record serialized whole into a single {@code data} column. */
    STRINGIFIED
}
