package com.rollupquery.config;

import com.rollupquery.domain.model.TimeGranularity;
import com.rollupquery.domain.routing.RollupCatalog;
import com.rollupquery.domain.routing.RollupRouter;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rollup tables available to the router. These must match what the
 * ingestion pipeline has actually built; nothing here checks that.
 */
@ConfigurationProperties("rollup")
@Data
@Validated
public class RollupCatalogProperties {

    /**
     * Table or view holding unaggregated events, used when no rollup fits.
     */
    @NotBlank
    String rawSource = RollupCatalog.DEFAULT_RAW_SOURCE;

    /**
     * Dimensions stored in every rollup.
     */
    @NotNull
    List<String> baseDimensions = new ArrayList<>(List.of("type"));

    /**
     * Rollup column holding the row count of each group.
     */
    @NotBlank
    String countColumn = RollupCatalog.DEFAULT_COUNT_COLUMN;

    /**
     * Raw measure column to the rollup column holding its sum.
     */
    @NotNull
    Map<String, String> measures = new LinkedHashMap<>(Map.of(
            "bid_price", "sum_bid",
            "total_price", "sum_total"));

    @Valid
    @NotNull
    List<Rollup> rollups = new ArrayList<>();

    @Valid
    @NotNull
    Router router = new Router();

    @Data
    public static class Rollup {

        @NotBlank
        String name;

        @NotEmpty
        List<String> dimensions = new ArrayList<>();

        /**
         * Time column granularity, unset for dimension-only rollups.
         */
        TimeGranularity timeGranularity;

        int priority = 1;
    }

    @Data
    public static class Router {

        /**
         * Maximum number of memoized routing decisions.
         */
        @Min(1)
        int decisionCacheSize = RollupRouter.DEFAULT_DECISION_CACHE_SIZE;
    }
}
