package com.rollupquery.infrastructure.cache;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class CacheEntrySummary {

    String key;
    long accessCount;
    long sizeBytes;
    Duration age;
}
