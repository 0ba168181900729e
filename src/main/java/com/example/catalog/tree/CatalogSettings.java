package com.example.catalog.tree;

import com.example.catalog.CatalogConfigurationException;
import com.example.catalog.array.RemoteBlockArray;
import com.example.catalog.persistence.dao.ChunkedCursor;

/**
 * Tuning knobs shared by a catalog and everything built from it.
 *
 * @param batchSize        documents per pagination round
 * @param rowsPerBlock     events per block along the first axis of a field array
 * @param fetchConcurrency blocks fetched at once by one array read
 */
public record CatalogSettings(int batchSize, int rowsPerBlock, int fetchConcurrency) {
    public static final int DEFAULT_ROWS_PER_BLOCK = 100;

    public static final CatalogSettings DEFAULTS = new CatalogSettings(
            ChunkedCursor.DEFAULT_BATCH_SIZE, DEFAULT_ROWS_PER_BLOCK, RemoteBlockArray.DEFAULT_CONCURRENCY);

    public CatalogSettings {
        if (batchSize < 1 || rowsPerBlock < 1 || fetchConcurrency < 1) {
            throw new CatalogConfigurationException(
                    "batchSize, rowsPerBlock and fetchConcurrency must all be >= 1");
        }
    }
}
