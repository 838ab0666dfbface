package com.rollupquery.domain.routing;

import com.rollupquery.domain.key.CanonicalKeyBuilder;
import com.rollupquery.domain.model.AggregateFunction;
import com.rollupquery.domain.model.QueryDescriptor;
import com.rollupquery.domain.model.RollupDescriptor;
import com.rollupquery.domain.model.SelectItem;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Chooses the smallest sufficient rollup for a query, or the raw source.
 *
 * A rollup is eligible only when it holds every GROUP BY column and every
 * WHERE column. A filter on a column the rollup does not store cannot be
 * applied after aggregation, so such a rollup would answer over the wrong
 * population; it is excluded outright rather than scored down.
 *
 * Among eligible rollups the score is
 * {@code priority * 10 + 2 * pushedFilters + (exact ? 20 : 0)}.
 * An exact dimensional match, when one exists, beats any coarser-grained
 * superset. Remaining ties go to fewer dimensions, then higher priority,
 * then catalog order.
 *
 * Decisions are memoized by canonical key in an LRU map guarded by a single
 * lock. route() never throws for a well-formed descriptor.
 */
@Slf4j
public class RollupRouter {

    /**
     * Weight of a rollup's configured priority.
     */
    public static final int PRIORITY_WEIGHT = 10;

    /**
     * Bonus per WHERE column the rollup can filter on.
     */
    public static final int PUSHED_FILTER_BONUS = 2;

    /**
     * Penalty per WHERE column the rollup lacks. Any such column also makes
     * the rollup ineligible, so the penalty never decides a route.
     */
    public static final int UNSUPPORTED_FILTER_PENALTY = 5;

    /**
     * Bonus when the rollup groups by exactly the requested columns.
     */
    public static final int EXACT_MATCH_BONUS = 20;

    public static final int INELIGIBLE = 0;

    public static final int DEFAULT_DECISION_CACHE_SIZE = 10_000;

    private final RollupCatalog catalog;
    private final int maxDecisions;

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, String> decisions;
    private final Map<String, Long> routedBySource = new LinkedHashMap<>();
    private long decisionCacheHits;

    public RollupRouter(RollupCatalog catalog) {
        this(catalog, DEFAULT_DECISION_CACHE_SIZE);
    }

    public RollupRouter(RollupCatalog catalog, int maxDecisions) {
        if (maxDecisions < 1) {
            throw new IllegalArgumentException("Decision cache size must be positive: " + maxDecisions);
        }
        this.catalog = catalog;
        this.maxDecisions = maxDecisions;
        this.decisions = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, String> eldest) {
                return size() > RollupRouter.this.maxDecisions;
            }
        };
    }

    public RollupCatalog getCatalog() {
        return catalog;
    }

    /**
     * Returns the name of the rollup to query, or the catalog's raw source.
     */
    public String route(QueryDescriptor descriptor) {
        String key = CanonicalKeyBuilder.canonicalize(descriptor);

        lock.lock();
        try {
            String cached = decisions.get(key);
            if (cached != null) {
                decisionCacheHits++;
                routedBySource.merge(cached, 1L, Long::sum);
                return cached;
            }
        } finally {
            lock.unlock();
        }

        // scoring reads only immutable state
        String source = decide(descriptor);

        lock.lock();
        try {
            decisions.put(key, source);
            routedBySource.merge(source, 1L, Long::sum);
        } finally {
            lock.unlock();
        }

        log.debug("Routed query to {}: {}", source, key);
        return source;
    }

    public void clearCache() {
        lock.lock();
        try {
            decisions.clear();
        } finally {
            lock.unlock();
        }
        log.debug("Routing decision cache cleared");
    }

    public RoutingStats stats() {
        lock.lock();
        try {
            return RoutingStats.builder()
                    .decisionCacheSize(decisions.size())
                    .maxDecisionCacheSize(maxDecisions)
                    .decisionCacheHits(decisionCacheHits)
                    .routedBySource(Map.copyOf(routedBySource))
                    .catalogSize(catalog.size())
                    .build();
        } finally {
            lock.unlock();
        }
    }

    String decide(QueryDescriptor descriptor) {
        if (descriptor.hasSourceOverride()) {
            return resolveOverride(descriptor);
        }
        if (!isRollupAnswerable(descriptor)) {
            return catalog.getRawSource();
        }
        return findBestRollup(descriptor.groupByColumns(), descriptor.whereColumns())
                .map(RollupDescriptor::getName)
                .orElse(catalog.getRawSource());
    }

    /**
     * Whether the select list and grouping can in principle come from a
     * rollup: only COUNT, SUM and AVG, sums only over stored measures, and
     * no grouping on a column that no rollup keeps (timestamps, user ids).
     */
    boolean isRollupAnswerable(QueryDescriptor descriptor) {
        for (SelectItem item : descriptor.aggregates()) {
            AggregateFunction function = item.getFunction();
            if (!function.isRollupCompatible()) {
                return false;
            }
            if (function != AggregateFunction.COUNT && !catalog.isMeasure(item.getColumn())) {
                return false;
            }
        }
        return catalog.getKnownDimensions().containsAll(descriptor.groupByColumns());
    }

    Optional<RollupDescriptor> findBestRollup(Set<String> groupBy, Set<String> whereColumns) {
        List<Candidate> candidates = new ArrayList<>();
        List<RollupDescriptor> rollups = catalog.getRollups();
        for (int i = 0; i < rollups.size(); i++) {
            RollupDescriptor rollup = rollups.get(i);
            int score = score(rollup, groupBy, whereColumns);
            if (score > INELIGIBLE) {
                candidates.add(new Candidate(rollup, score, isExactMatch(rollup, groupBy), i));
            }
        }

        boolean anyExact = candidates.stream().anyMatch(Candidate::exact);
        if (anyExact || groupBy.isEmpty()) {
            // an ungrouped query only fits a rollup with no extra dimensions
            candidates.removeIf(candidate -> !candidate.exact());
        }

        return candidates.stream()
                .min(Candidate.PREFERENCE)
                .map(Candidate::rollup);
    }

    /**
     * Match score of one rollup; {@link #INELIGIBLE} when it cannot answer
     * the query correctly.
     */
    public int score(RollupDescriptor rollup, Set<String> groupBy, Set<String> whereColumns) {
        if (!rollup.covers(groupBy)) {
            return INELIGIBLE;
        }

        int score = rollup.getPriority() * PRIORITY_WEIGHT;
        int unsupported = 0;
        for (String column : whereColumns) {
            if (rollup.getDimensions().contains(column)) {
                score += PUSHED_FILTER_BONUS;
            } else {
                score -= UNSUPPORTED_FILTER_PENALTY;
                unsupported++;
            }
        }
        if (unsupported > 0) {
            return INELIGIBLE;
        }

        if (isExactMatch(rollup, groupBy)) {
            score += EXACT_MATCH_BONUS;
        }
        return Math.max(score, INELIGIBLE);
    }

    /**
     * Exact when the rollup groups by the requested columns and nothing
     * else, not counting base dimensions every rollup carries.
     */
    boolean isExactMatch(RollupDescriptor rollup, Set<String> groupBy) {
        Set<String> dimensions = rollup.getDimensions();
        if (dimensions.equals(groupBy)) {
            return true;
        }
        Set<String> withBase = new HashSet<>(groupBy);
        withBase.addAll(catalog.getBaseDimensions());
        return dimensions.equals(withBase);
    }

    private String resolveOverride(QueryDescriptor descriptor) {
        String requested = descriptor.getSource();
        if (catalog.isRawSource(requested)) {
            return requested;
        }
        Optional<RollupDescriptor> rollup = catalog.find(requested);
        if (rollup.isEmpty()) {
            // only catalog tables are queryable
            log.warn("Requested source {} is not in the rollup catalog, using {}",
                    requested, catalog.getRawSource());
            return catalog.getRawSource();
        }
        if (isRollupAnswerable(descriptor)
                && score(rollup.get(), descriptor.groupByColumns(), descriptor.whereColumns()) > INELIGIBLE) {
            return requested;
        }
        log.warn("Requested rollup {} cannot answer the query correctly, using {}",
                requested, catalog.getRawSource());
        return catalog.getRawSource();
    }

    private static final class Candidate {

        static final Comparator<Candidate> PREFERENCE = Comparator
                .comparingInt((Candidate c) -> -c.score)
                .thenComparingInt(c -> c.rollup.getDimensions().size())
                .thenComparingInt(c -> -c.rollup.getPriority())
                .thenComparingInt(c -> c.position);

        private final RollupDescriptor rollup;
        private final int score;
        private final boolean exact;
        private final int position;

        Candidate(RollupDescriptor rollup, int score, boolean exact, int position) {
            this.rollup = rollup;
            this.score = score;
            this.exact = exact;
            this.position = position;
        }

        RollupDescriptor rollup() {
            return rollup;
        }

        boolean exact() {
            return exact;
        }
    }
}
