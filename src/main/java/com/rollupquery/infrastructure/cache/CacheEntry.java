package com.rollupquery.infrastructure.cache;

import com.rollupquery.domain.model.QueryResult;
import lombok.Getter;

import java.time.Instant;

/**
 * A cached result with its bookkeeping. Only the access count changes after
 * creation, and only under the owning cache's lock.
 */
@Getter
class CacheEntry {

    private final String key;
    private final QueryResult payload;
    private final Instant createdAt;
    private final long sizeBytes;
    private long accessCount;

    CacheEntry(String key, QueryResult payload, Instant createdAt, long sizeBytes) {
        this.key = key;
        this.payload = payload;
        this.createdAt = createdAt;
        this.sizeBytes = sizeBytes;
        this.accessCount = 1;
    }

    void recordAccess() {
        accessCount++;
    }
}
