package com.rollupquery.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response model for an executed aggregate query.
 *
 * Reports which source answered it and whether the result came from cache
 * or from the raw fallback after a rollup failure.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryExecutionResponse {

    private String source;
    private List<String> columns;
    private List<List<Object>> rows;
    private boolean cached;
    private boolean fallback;
    private long queryTimeMs;
}
