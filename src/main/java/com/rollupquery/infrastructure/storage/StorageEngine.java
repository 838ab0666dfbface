package com.rollupquery.infrastructure.storage;

import com.rollupquery.domain.model.QueryResult;

/**
 * Executes assembled SQL against the columnar store.
 */
public interface StorageEngine {

    /**
     * @throws QueryExecutionException if the store rejects or fails the query
     */
    QueryResult execute(String sql);
}
