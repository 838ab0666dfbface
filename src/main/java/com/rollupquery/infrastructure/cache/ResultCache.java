package com.rollupquery.infrastructure.cache;

import com.rollupquery.domain.key.CanonicalKeyBuilder;
import com.rollupquery.domain.model.QueryDescriptor;
import com.rollupquery.domain.model.QueryResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory cache of query results with LRU eviction, TTL expiry and a
 * byte budget.
 *
 * Entries are keyed by the descriptor's canonical key. Expiry is lazy: a
 * stale entry is dropped when it is next read (or by {@link #purgeExpired()}).
 * After every put the cache holds at most {@code maxEntries} entries and
 * {@code maxSizeBytes} estimated bytes, evicting least recently used
 * entries first.
 *
 * Every operation that touches the map or its counters runs under one
 * write lock, so the size counter and the map never disagree. A hit
 * changes recency, so get() is a writer too; stats() and topEntries()
 * only read.
 */
@Slf4j
public class ResultCache {

    private final long maxSizeBytes;
    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    // access order: iteration starts at the least recently used entry
    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);
    private long currentSizeBytes;

    private long hits;
    private long misses;
    private long evictions;

    public ResultCache(long maxSizeBytes, Duration ttl, int maxEntries) {
        this(maxSizeBytes, ttl, maxEntries, Clock.systemUTC());
    }

    public ResultCache(long maxSizeBytes, Duration ttl, int maxEntries, Clock clock) {
        if (maxSizeBytes <= 0) {
            throw new IllegalArgumentException("maxSizeBytes must be positive: " + maxSizeBytes);
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be zero or positive: " + ttl);
        }
        this.maxSizeBytes = maxSizeBytes;
        this.ttl = ttl;
        this.maxEntries = maxEntries;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Optional<QueryResult> get(QueryDescriptor descriptor) {
        return get(CanonicalKeyBuilder.canonicalize(descriptor));
    }

    /**
     * Returns the cached result, or empty on a miss. An empty result set is
     * a hit.
     */
    public Optional<QueryResult> get(String key) {
        lock.writeLock().lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                misses++;
                log.debug("Cache miss for key: {}", key);
                return Optional.empty();
            }

            if (isExpired(entry, clock.instant())) {
                removeEntry(key, entry);
                misses++;
                log.debug("Cache entry expired for key: {}", key);
                return Optional.empty();
            }

            entry.recordAccess();
            hits++;
            log.debug("Cache hit for key: {}", key);
            return Optional.of(entry.getPayload());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void put(QueryDescriptor descriptor, QueryResult result) {
        put(CanonicalKeyBuilder.canonicalize(descriptor), result);
    }

    public void put(String key, QueryResult result) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(result, "result");
        long sizeBytes = PayloadSizeEstimator.estimate(result);

        lock.writeLock().lock();
        try {
            CacheEntry previous = entries.remove(key);
            if (previous != null) {
                currentSizeBytes -= previous.getSizeBytes();
            }

            entries.put(key, new CacheEntry(key, result, clock.instant(), sizeBytes));
            currentSizeBytes += sizeBytes;
            log.debug("Cached result for key: {} ({} bytes)", key, sizeBytes);

            evictIfNeeded();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Drops all entries. Hit, miss and eviction counters are kept.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
            currentSizeBytes = 0;
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Result cache cleared");
    }

    /**
     * Removes every expired entry now instead of waiting for it to be read.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            int removed = 0;
            Iterator<CacheEntry> it = entries.values().iterator();
            while (it.hasNext()) {
                CacheEntry entry = it.next();
                if (isExpired(entry, now)) {
                    it.remove();
                    currentSizeBytes -= entry.getSizeBytes();
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public CacheStats stats() {
        lock.readLock().lock();
        try {
            long requests = hits + misses;
            return CacheStats.builder()
                    .hits(hits)
                    .misses(misses)
                    .hitRate(requests > 0 ? (double) hits / requests : 0.0)
                    .evictions(evictions)
                    .currentSizeBytes(currentSizeBytes)
                    .maxSizeBytes(maxSizeBytes)
                    .entries(entries.size())
                    .maxEntries(maxEntries)
                    .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Most frequently read entries first. Entries with equal counts keep
     * recency order, least recently used first.
     */
    public List<CacheEntrySummary> topEntries(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        lock.readLock().lock();
        try {
            Instant now = clock.instant();
            List<CacheEntry> snapshot = new ArrayList<>(entries.values());
            snapshot.sort(Comparator.comparingLong(CacheEntry::getAccessCount).reversed());

            List<CacheEntrySummary> top = new ArrayList<>(Math.min(limit, snapshot.size()));
            for (CacheEntry entry : snapshot.subList(0, Math.min(limit, snapshot.size()))) {
                top.add(CacheEntrySummary.builder()
                        .key(entry.getKey())
                        .accessCount(entry.getAccessCount())
                        .sizeBytes(entry.getSizeBytes())
                        .age(Duration.between(entry.getCreatedAt(), now))
                        .build());
            }
            return top;
        } finally {
            lock.readLock().unlock();
        }
    }

    public long getMaxSizeBytes() {
        return maxSizeBytes;
    }

    public Duration getTtl() {
        return ttl;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    private boolean isExpired(CacheEntry entry, Instant now) {
        return Duration.between(entry.getCreatedAt(), now).compareTo(ttl) > 0;
    }

    private void removeEntry(String key, CacheEntry entry) {
        entries.remove(key);
        currentSizeBytes -= entry.getSizeBytes();
    }

    // caller holds the write lock
    private void evictIfNeeded() {
        while (currentSizeBytes > maxSizeBytes || entries.size() > maxEntries) {
            Iterator<Map.Entry<String, CacheEntry>> eldest = entries.entrySet().iterator();
            if (!eldest.hasNext()) {
                break;
            }
            CacheEntry evicted = eldest.next().getValue();
            eldest.remove();
            currentSizeBytes -= evicted.getSizeBytes();
            evictions++;
            log.debug("Evicted cache entry: {} ({} bytes)", evicted.getKey(), evicted.getSizeBytes());
        }
    }
}
