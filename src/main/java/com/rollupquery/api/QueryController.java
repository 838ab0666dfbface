package com.rollupquery.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.rollupquery.domain.model.QueryDescriptor;
import com.rollupquery.domain.model.QueryExecutionResponse;
import com.rollupquery.domain.model.RollupDescriptor;
import com.rollupquery.domain.parse.QueryDescriptorParser;
import com.rollupquery.domain.routing.RollupRouter;
import com.rollupquery.domain.routing.RoutingStats;
import com.rollupquery.domain.service.QueryService;
import com.rollupquery.infrastructure.cache.CacheEntrySummary;
import com.rollupquery.infrastructure.cache.CacheStats;
import com.rollupquery.infrastructure.cache.ResultCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST API for aggregate queries.
 *
 * Endpoints:
 * - POST /api/v1/queries - Execute a query descriptor
 * - POST /api/v1/queries/batch - Execute several descriptors concurrently
 * - POST /api/v1/queries/route - Show which source a descriptor routes to
 * - GET /api/v1/cache/stats - Result cache statistics
 * - GET /api/v1/cache/top - Most frequently read cache entries
 * - DELETE /api/v1/cache - Drop cached results
 * - GET /api/v1/routing/stats - Routing statistics
 * - GET /api/v1/routing/catalog - Configured rollups
 * - DELETE /api/v1/routing/cache - Drop memoized routing decisions
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class QueryController {

    private final QueryService queryService;
    private final QueryDescriptorParser parser;
    private final ResultCache resultCache;
    private final RollupRouter router;

    /**
     * Execute a query.
     *
     * POST /api/v1/queries
     *
     * Request body:
     * {
     *   "select": ["country", {"COUNT": "*"}],
     *   "group_by": ["country"],
     *   "where": [{"col": "type", "op": "eq", "val": "impression"}],
     *   "order_by": [{"col": "COUNT(*)", "dir": "desc"}]
     * }
     *
     * Response:
     * - source: rollup or raw table that answered
     * - columns, rows: the result
     * - cached: whether the result came from the cache
     * - fallback: whether a failed rollup was retried on raw data
     * - queryTimeMs: execution time
     */
    @PostMapping("/queries")
    public ResponseEntity<QueryExecutionResponse> execute(@RequestBody JsonNode body) {
        QueryDescriptor descriptor = parser.parse(body);
        log.info("Execute query: groupBy={}, where={}", descriptor.getGroupBy(), descriptor.whereColumns());
        return ResponseEntity.ok(queryService.execute(descriptor));
    }

    @PostMapping("/queries/batch")
    public ResponseEntity<List<QueryExecutionResponse>> executeBatch(@RequestBody JsonNode body) {
        List<QueryDescriptor> descriptors = parser.parseAll(body);
        log.info("Execute batch of {} queries", descriptors.size());
        return ResponseEntity.ok(queryService.executeBatch(descriptors));
    }

    @PostMapping("/queries/route")
    public ResponseEntity<Map<String, String>> route(@RequestBody JsonNode body) {
        QueryDescriptor descriptor = parser.parse(body);
        return ResponseEntity.ok(Map.of("source", queryService.route(descriptor)));
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<CacheStats> cacheStats() {
        return ResponseEntity.ok(resultCache.stats());
    }

    @GetMapping("/cache/top")
    public ResponseEntity<List<CacheEntrySummary>> topCacheEntries(
            @RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(resultCache.topEntries(limit));
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> clearCache() {
        log.info("Clear result cache");
        resultCache.clear();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/routing/stats")
    public ResponseEntity<RoutingStats> routingStats() {
        return ResponseEntity.ok(router.stats());
    }

    @GetMapping("/routing/catalog")
    public ResponseEntity<List<RollupDescriptor>> catalog() {
        return ResponseEntity.ok(router.getCatalog().getRollups());
    }

    @DeleteMapping("/routing/cache")
    public ResponseEntity<Void> clearRoutingCache() {
        log.info("Clear routing decision cache");
        router.clearCache();
        return ResponseEntity.noContent().build();
    }

    /**
     * Health check endpoint.
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
