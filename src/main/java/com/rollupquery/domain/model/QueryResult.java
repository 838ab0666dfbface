package com.rollupquery.domain.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Column names plus row tuples, as returned by the storage engine.
 *
 * Read-only once built; the cache hands out the same instance to every
 * reader. A result with no rows is still a result.
 */
@Value
public class QueryResult {

    List<String> columns;
    List<List<Object>> rows;

    /**
     * Table or rollup that produced the rows, null until the harness records it.
     */
    String source;

    public QueryResult(List<String> columns, List<? extends List<?>> rows) {
        this(columns, rows, null);
    }

    public QueryResult(List<String> columns, List<? extends List<?>> rows, String source) {
        this.source = source;
        this.columns = List.copyOf(columns);
        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (List<?> row : rows) {
            // rows may carry SQL NULLs, which List.copyOf rejects
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public static QueryResult empty(List<String> columns) {
        return new QueryResult(columns, List.of());
    }

    public QueryResult withSource(String newSource) {
        return new QueryResult(columns, rows, newSource);
    }

    public int getRowCount() {
        return rows.size();
    }
}
