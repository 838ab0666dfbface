package com.rollupquery.domain.service;

import com.rollupquery.config.QueryProperties;
import com.rollupquery.domain.model.QueryDescriptor;
import com.rollupquery.domain.model.QueryExecutionResponse;
import com.rollupquery.domain.model.QueryResult;
import com.rollupquery.domain.routing.RollupRouter;
import com.rollupquery.infrastructure.cache.ResultCache;
import com.rollupquery.infrastructure.sql.SqlAssembler;
import com.rollupquery.infrastructure.storage.QueryExecutionException;
import com.rollupquery.infrastructure.storage.StorageEngine;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Query execution for aggregate event queries.
 *
 * Query Flow:
 * 1. Route the descriptor to a rollup or the raw source
 * 2. Check the result cache
 * 3. On a miss, assemble SQL and execute it
 * 4. If a rollup query fails, retry once against the raw source
 * 5. Store the result, tagged with the source that answered, under the original descriptor
 *
 * Routing runs even on a cache hit; its decision is memoized, so the cost
 * is a map lookup, and the response can still report its source.
 */
@Slf4j
@Service
public class QueryService {

    private final RollupRouter router;
    private final ResultCache resultCache;
    private final SqlAssembler sqlAssembler;
    private final StorageEngine storageEngine;
    private final MeterRegistry meterRegistry;
    private final Executor queryExecutor;
    private final int maxBatchSize;

    @Autowired
    public QueryService(RollupRouter router,
                        ResultCache resultCache,
                        SqlAssembler sqlAssembler,
                        StorageEngine storageEngine,
                        MeterRegistry meterRegistry,
                        @Qualifier("queryExecutor") Executor queryExecutor,
                        QueryProperties queryProperties) {
        this.router = router;
        this.resultCache = resultCache;
        this.sqlAssembler = sqlAssembler;
        this.storageEngine = storageEngine;
        this.meterRegistry = meterRegistry;
        this.queryExecutor = queryExecutor;
        // every query of a batch must fit in the pool or its queue
        this.maxBatchSize = queryProperties.getBatchParallelism() + queryProperties.getBatchQueueCapacity();
    }

    public String route(QueryDescriptor descriptor) {
        return router.route(descriptor);
    }

    public QueryExecutionResponse execute(QueryDescriptor descriptor) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String source = router.route(descriptor);

        Optional<QueryResult> cached = resultCache.get(descriptor);
        if (cached.isPresent()) {
            QueryResult hit = cached.get();
            // report the source that produced the rows, which differs after a fallback
            String answeredBy = hit.getSource() != null ? hit.getSource() : source;
            Counter.builder("query.cache")
                    .tag("result", "hit")
                    .register(meterRegistry)
                    .increment();

            sample.stop(Timer.builder("query.latency")
                    .tag("cached", "true")
                    .register(meterRegistry));

            return QueryExecutionResponse.builder()
                    .source(answeredBy)
                    .columns(hit.getColumns())
                    .rows(hit.getRows())
                    .cached(true)
                    .fallback(!answeredBy.equals(source))
                    .queryTimeMs(0)
                    .build();
        }

        Counter.builder("query.cache")
                .tag("result", "miss")
                .register(meterRegistry)
                .increment();

        long startTime = System.currentTimeMillis();
        boolean fallback = false;
        QueryResult result;
        try {
            result = run(descriptor, source);
        } catch (QueryExecutionException e) {
            if (router.getCatalog().isRawSource(source)) {
                recordFailure(source);
                log.error("Query failed on raw source {}: {}", source, e.getMessage(), e);
                throw e;
            }
            log.warn("Query failed on {}, falling back to raw source: {}", source, e.getMessage());
            Counter.builder("query.fallback")
                    .tag("source", source)
                    .register(meterRegistry)
                    .increment();

            source = router.route(descriptor.withSource(router.getCatalog().getRawSource()));
            fallback = true;
            try {
                result = run(descriptor, source);
            } catch (QueryExecutionException fallbackFailure) {
                recordFailure(source);
                log.error("Raw fallback failed as well: {}", fallbackFailure.getMessage(), fallbackFailure);
                throw fallbackFailure;
            }
        }
        long queryTime = System.currentTimeMillis() - startTime;

        resultCache.put(descriptor, result.withSource(source));

        sample.stop(Timer.builder("query.latency")
                .tag("cached", "false")
                .register(meterRegistry));

        Counter.builder("query.executed")
                .tag("source", source)
                .register(meterRegistry)
                .increment();

        log.info("Query executed on {}: {} rows, {} ms{}", source, result.getRowCount(), queryTime,
                fallback ? " (fallback)" : "");

        return QueryExecutionResponse.builder()
                .source(source)
                .columns(result.getColumns())
                .rows(result.getRows())
                .cached(false)
                .fallback(fallback)
                .queryTimeMs(queryTime)
                .build();
    }

    /**
     * Executes descriptors concurrently on the query pool. Responses come
     * back in input order; the first failure is rethrown. A batch larger
     * than the pool plus its queue is refused before anything is submitted.
     */
    public List<QueryExecutionResponse> executeBatch(List<QueryDescriptor> descriptors) {
        if (descriptors.size() > maxBatchSize) {
            throw new IllegalArgumentException("Batch of " + descriptors.size()
                    + " queries exceeds the limit of " + maxBatchSize);
        }
        List<CompletableFuture<QueryExecutionResponse>> futures = descriptors.stream()
                .map(descriptor -> CompletableFuture.supplyAsync(() -> execute(descriptor), queryExecutor))
                .toList();
        try {
            return futures.stream()
                    .map(CompletableFuture::join)
                    .toList();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    private QueryResult run(QueryDescriptor descriptor, String source) {
        Counter.builder("query.routed")
                .tag("source", source)
                .register(meterRegistry)
                .increment();
        String sql = sqlAssembler.assemble(descriptor, source);
        log.debug("Executing on {}: {}", source, sql);
        return storageEngine.execute(sql);
    }

    private void recordFailure(String source) {
        Counter.builder("query.failed")
                .tag("source", source)
                .register(meterRegistry)
                .increment();
    }
}
