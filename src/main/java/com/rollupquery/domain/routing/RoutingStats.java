package com.rollupquery.domain.routing;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class RoutingStats {

    int decisionCacheSize;
    int maxDecisionCacheSize;
    long decisionCacheHits;

    /**
     * route() calls per returned source, cached decisions included.
     */
    Map<String, Long> routedBySource;

    int catalogSize;
}
