package com.rollupquery.infrastructure.storage;

/**
 * The storage engine could not execute a query, e.g. a rollup table whose
 * schema drifted from the catalog or an unreachable database.
 */
public class QueryExecutionException extends RuntimeException {

    private final String sql;

    public QueryExecutionException(String message, String sql, Throwable cause) {
        super(message, cause);
        this.sql = sql;
    }

    public String getSql() {
        return sql;
    }
}
