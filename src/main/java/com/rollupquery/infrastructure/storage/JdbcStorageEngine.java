package com.rollupquery.infrastructure.storage;

import com.rollupquery.domain.model.QueryResult;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Storage engine backed by a JDBC data source.
 *
 * Column labels are lower-cased and {@code count(*)} is reported as
 * {@code count_star()}, so rollup and raw answers to the same query carry
 * the same column names.
 *
 * A circuit breaker stops hammering a store that keeps failing; its
 * fallback surfaces the failure as a QueryExecutionException either way.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcStorageEngine implements StorageEngine {

    private final JdbcTemplate jdbcTemplate;

    @Override
    @CircuitBreaker(name = "storage", fallbackMethod = "executeFallback")
    public QueryResult execute(String sql) {
        try {
            return jdbcTemplate.query(sql, (ResultSetExtractor<QueryResult>) JdbcStorageEngine::extract);
        } catch (DataAccessException e) {
            throw new QueryExecutionException("Query failed: " + e.getMostSpecificCause().getMessage(), sql, e);
        }
    }

    static QueryResult extract(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();

        List<String> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(normalizeColumn(meta.getColumnLabel(i)));
        }

        List<List<Object>> rows = new ArrayList<>();
        while (rs.next()) {
            List<Object> row = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                row.add(rs.getObject(i));
            }
            rows.add(row);
        }
        return new QueryResult(columns, rows);
    }

    static String normalizeColumn(String label) {
        return label.toLowerCase(Locale.ROOT).replace("count(*)", "count_star()");
    }

    // Fallback methods (circuit breaker)

    private QueryResult executeFallback(String sql, QueryExecutionException e) {
        throw e;
    }

    private QueryResult executeFallback(String sql, Exception e) {
        log.warn("Storage circuit breaker rejected query: {}", e.getMessage());
        throw new QueryExecutionException("Storage engine unavailable: " + e.getMessage(), sql, e);
    }
}
