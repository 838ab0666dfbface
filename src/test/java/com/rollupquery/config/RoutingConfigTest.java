package com.rollupquery.config;

import com.rollupquery.domain.model.TimeGranularity;
import com.rollupquery.domain.routing.RollupCatalog;
import com.rollupquery.domain.routing.RollupRouter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoutingConfigTest {

    private final RoutingConfig config = new RoutingConfig();

    @Test
    void testRollupCatalog_BuiltFromProperties() {
        // Given
        RollupCatalogProperties properties = new RollupCatalogProperties();
        properties.getRollups().add(rollup("by_day", TimeGranularity.DAY, 10, "day", "type"));
        properties.getRollups().add(rollup("by_country", null, 8, "country", "type"));

        // When
        RollupCatalog catalog = config.rollupCatalog(properties);

        // Then
        assertEquals(2, catalog.size());
        assertEquals("events_parquet", catalog.getRawSource());
        assertEquals("cnt", catalog.getCountColumn());
        assertTrue(catalog.isMeasure("bid_price"));
        assertEquals("sum_total", catalog.getMeasureColumns().get("total_price"));
        assertTrue(catalog.getBaseDimensions().contains("type"));
        assertEquals(TimeGranularity.DAY, catalog.find("by_day").orElseThrow().getTimeGranularity());
        assertFalse(catalog.find("by_country").orElseThrow().hasTimeDimension());
    }

    @Test
    void testRollupRouter_UsesConfiguredCacheSize() {
        // Given
        RollupCatalogProperties properties = new RollupCatalogProperties();
        properties.getRouter().setDecisionCacheSize(16);
        RollupCatalog catalog = config.rollupCatalog(properties);

        // When
        RollupRouter router = config.rollupRouter(catalog, properties);

        // Then
        assertEquals(16, router.stats().getMaxDecisionCacheSize());
        assertSame(catalog, router.getCatalog());
    }

    @Test
    void testRollupCatalog_RejectsRollupNamedLikeRawSource() {
        // Given
        RollupCatalogProperties properties = new RollupCatalogProperties();
        properties.getRollups().add(rollup("events_parquet", null, 1, "type"));

        // When / Then
        assertThrows(IllegalArgumentException.class, () -> config.rollupCatalog(properties));
    }

    private static RollupCatalogProperties.Rollup rollup(String name, TimeGranularity granularity,
                                                         int priority, String... dimensions) {
        RollupCatalogProperties.Rollup rollup = new RollupCatalogProperties.Rollup();
        rollup.setName(name);
        rollup.setDimensions(List.of(dimensions));
        rollup.setTimeGranularity(granularity);
        rollup.setPriority(priority);
        return rollup;
    }
}
