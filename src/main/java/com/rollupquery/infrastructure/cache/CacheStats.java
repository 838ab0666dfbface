package com.rollupquery.infrastructure.cache;

import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time view of the result cache. Hit, miss and eviction counts are
 * cumulative since the cache was created and survive clear().
 */
@Value
@Builder
public class CacheStats {

    long hits;
    long misses;

    /**
     * hits / (hits + misses), 0 before the first request.
     */
    double hitRate;

    long evictions;
    long currentSizeBytes;
    long maxSizeBytes;
    int entries;
    int maxEntries;
}
