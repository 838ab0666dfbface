package com.rollupquery.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A materialized rollup table: events grouped by {@link #dimensions}, with
 * the measures count, sum(bid_price) and sum(total_price) stored per group.
 *
 * AVG is never stored; it is derived as sum / count when querying.
 */
@Value
public class RollupDescriptor {

    String name;
    Set<String> dimensions;

    /**
     * Granularity of the time column, null for dimension-only rollups.
     */
    TimeGranularity timeGranularity;

    /**
     * Higher wins when otherwise equal.
     */
    int priority;

    @Builder
    public RollupDescriptor(String name, Set<String> dimensions,
                            TimeGranularity timeGranularity, int priority) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Rollup name must not be blank");
        }
        this.name = name;
        this.dimensions = Collections.unmodifiableSet(
                new LinkedHashSet<>(Objects.requireNonNull(dimensions, "dimensions")));
        this.timeGranularity = timeGranularity;
        this.priority = priority;
    }

    public boolean hasTimeDimension() {
        return timeGranularity != null;
    }

    public boolean covers(Set<String> columns) {
        return dimensions.containsAll(columns);
    }
}
