package com.s1export.collector.sink;

import com.s1export.collector.normalize.TabularDataset;

import java.io.IOException;

/**
 * Persists a normalized dataset. Whether empty tables are written is up to the sink.
 */
public interface TableSink {

    /**
     * @param table       the table to persist
     * @param datasetName logical dataset name; the destination name is derived from it
     * @return where the rows went and how many made it
     * @throws IOException if the destination cannot be written
     */
    SinkResult write(TabularDataset table, String datasetName) throws IOException;
}
