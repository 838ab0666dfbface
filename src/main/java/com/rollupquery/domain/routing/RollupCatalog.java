package com.rollupquery.domain.routing;

import com.rollupquery.domain.model.RollupDescriptor;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed set of materialized rollups the router may choose from, plus the
 * raw source used when none fits.
 *
 * Built once at startup and never mutated, so it is shared without locking.
 * The catalog does not check that the tables actually exist.
 */
@Getter
public class RollupCatalog {

    public static final String DEFAULT_RAW_SOURCE = "events_parquet";
    public static final String DEFAULT_COUNT_COLUMN = "cnt";

    /**
     * Rollups in declaration order; earlier entries win exact ties.
     */
    private final List<RollupDescriptor> rollups;

    private final String rawSource;

    /**
     * Dimensions physically present in every rollup, e.g. the event type.
     */
    private final Set<String> baseDimensions;

    private final String countColumn;

    /**
     * Raw measure column to its stored sum column, e.g. bid_price to sum_bid.
     */
    private final Map<String, String> measureColumns;

    /**
     * Union of all rollup dimensions. A group-by column outside it can only
     * be answered from raw data.
     */
    private final Set<String> knownDimensions;

    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, RollupDescriptor> rollupsByName;

    @Builder
    public RollupCatalog(@Singular List<RollupDescriptor> rollups,
                         String rawSource,
                         @Singular Set<String> baseDimensions,
                         String countColumn,
                         @Singular Map<String, String> measureColumns) {
        this.rollups = List.copyOf(rollups);
        this.rawSource = rawSource == null || rawSource.isBlank() ? DEFAULT_RAW_SOURCE : rawSource;
        this.baseDimensions = Collections.unmodifiableSet(new LinkedHashSet<>(baseDimensions));
        this.countColumn = countColumn == null || countColumn.isBlank() ? DEFAULT_COUNT_COLUMN : countColumn;
        this.measureColumns = Collections.unmodifiableMap(new LinkedHashMap<>(measureColumns));

        Map<String, RollupDescriptor> byName = new LinkedHashMap<>();
        Set<String> dimensions = new LinkedHashSet<>();
        for (RollupDescriptor rollup : this.rollups) {
            if (byName.put(rollup.getName(), rollup) != null) {
                throw new IllegalArgumentException("Duplicate rollup name in catalog: " + rollup.getName());
            }
            if (rollup.getName().equals(this.rawSource)) {
                throw new IllegalArgumentException("Rollup name collides with the raw source: " + rollup.getName());
            }
            dimensions.addAll(rollup.getDimensions());
        }
        this.rollupsByName = Collections.unmodifiableMap(byName);
        this.knownDimensions = Collections.unmodifiableSet(dimensions);
    }

    public Optional<RollupDescriptor> find(String name) {
        return Optional.ofNullable(rollupsByName.get(name));
    }

    public boolean isRollup(String source) {
        return source != null && rollupsByName.containsKey(source);
    }

    public boolean isRawSource(String source) {
        return rawSource.equals(source);
    }

    public boolean isMeasure(String column) {
        return measureColumns.containsKey(column);
    }

    public int size() {
        return rollups.size();
    }
}
