package com.rollupquery.infrastructure.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drops expired results so stale entries that are never read
 * again do not hold memory until evicted. Correctness does not depend on it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResultCacheJanitor {

    private final ResultCache resultCache;

    @Scheduled(fixedDelayString = "${rollup.cache.purge-interval:PT1M}")
    public void purgeExpired() {
        int removed = resultCache.purgeExpired();
        if (removed > 0) {
            log.debug("Purged {} expired cache entries", removed);
        }
    }
}
