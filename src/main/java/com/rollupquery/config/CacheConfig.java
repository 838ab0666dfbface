package com.rollupquery.config;

import com.rollupquery.infrastructure.cache.ResultCache;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class CacheConfig {

    private final MeterRegistry meterRegistry;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ResultCache resultCache(ResultCacheProperties properties, Clock clock) {
        ResultCache cache = new ResultCache(
                properties.getMaxSize().toBytes(),
                properties.getTtl(),
                properties.getMaxEntries(),
                clock);
        monitor(cache);
        log.info("Result cache: max {} bytes, {} entries, ttl {}",
                cache.getMaxSizeBytes(), cache.getMaxEntries(), cache.getTtl());
        return cache;
    }

    private void monitor(ResultCache cache) {
        FunctionCounter.builder("rollup.cache.hits", cache, c -> c.stats().getHits())
                .description("Result cache hits")
                .register(meterRegistry);
        FunctionCounter.builder("rollup.cache.misses", cache, c -> c.stats().getMisses())
                .description("Result cache misses, expired entries included")
                .register(meterRegistry);
        FunctionCounter.builder("rollup.cache.evictions", cache, c -> c.stats().getEvictions())
                .description("Entries evicted to stay within size or count bounds")
                .register(meterRegistry);
        Gauge.builder("rollup.cache.size.bytes", cache, c -> c.stats().getCurrentSizeBytes())
                .description("Estimated size of cached results")
                .baseUnit("bytes")
                .register(meterRegistry);
        Gauge.builder("rollup.cache.entries", cache, c -> c.stats().getEntries())
                .description("Number of cached results")
                .register(meterRegistry);
    }
}
