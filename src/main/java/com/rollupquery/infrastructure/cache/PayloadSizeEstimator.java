package com.rollupquery.infrastructure.cache;

import com.rollupquery.domain.model.QueryResult;

import java.nio.charset.StandardCharsets;
import java.time.temporal.TemporalAccessor;
import java.util.Collection;
import java.util.Date;
import java.util.Map;

/**
 * Deterministic estimate of a result's in-memory footprint, used for the
 * cache's byte budget. It is a function of the result's shape only.
 */
public final class PayloadSizeEstimator {

    /**
     * Numbers, booleans and date/time values.
     */
    public static final long SCALAR_BYTES = 8;

    /**
     * Anything the estimator does not recognize.
     */
    public static final long FALLBACK_BYTES = 1024;

    private PayloadSizeEstimator() {
    }

    public static long estimate(QueryResult result) {
        return estimate(result.getColumns()) + estimate(result.getRows());
    }

    public static long estimate(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof CharSequence) {
            return value.toString().getBytes(StandardCharsets.UTF_8).length;
        }
        if (value instanceof Number || value instanceof Boolean
                || value instanceof TemporalAccessor || value instanceof Date) {
            return SCALAR_BYTES;
        }
        if (value instanceof Collection<?>) {
            long total = 0;
            for (Object element : (Collection<?>) value) {
                total += estimate(element);
            }
            return total;
        }
        if (value instanceof Map<?, ?>) {
            long total = 0;
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                total += estimate(entry.getKey()) + estimate(entry.getValue());
            }
            return total;
        }
        if (value instanceof byte[]) {
            return ((byte[]) value).length;
        }
        if (value instanceof QueryResult) {
            return estimate((QueryResult) value);
        }
        return FALLBACK_BYTES;
    }
}
