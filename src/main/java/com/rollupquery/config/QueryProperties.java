package com.rollupquery.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("rollup.query")
@Data
@Validated
public class QueryProperties {

    /**
     * Worker threads used to execute a batch of queries.
     */
    @Min(1)
    int batchParallelism = 4;

    /**
     * Queries waiting for a worker before submissions are rejected.
     */
    @Min(0)
    int batchQueueCapacity = 1000;
}
