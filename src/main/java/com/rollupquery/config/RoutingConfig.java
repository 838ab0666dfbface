package com.rollupquery.config;

import com.rollupquery.domain.model.RollupDescriptor;
import com.rollupquery.domain.routing.RollupCatalog;
import com.rollupquery.domain.routing.RollupRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashSet;

@Slf4j
@Configuration
public class RoutingConfig {

    @Bean
    public RollupCatalog rollupCatalog(RollupCatalogProperties properties) {
        RollupCatalog.RollupCatalogBuilder builder = RollupCatalog.builder()
                .rawSource(properties.getRawSource())
                .baseDimensions(properties.getBaseDimensions())
                .countColumn(properties.getCountColumn())
                .measureColumns(properties.getMeasures());

        for (RollupCatalogProperties.Rollup rollup : properties.getRollups()) {
            builder.rollup(RollupDescriptor.builder()
                    .name(rollup.getName())
                    .dimensions(new LinkedHashSet<>(rollup.getDimensions()))
                    .timeGranularity(rollup.getTimeGranularity())
                    .priority(rollup.getPriority())
                    .build());
        }

        RollupCatalog catalog = builder.build();
        log.info("Rollup catalog loaded: {} rollups, raw source {}", catalog.size(), catalog.getRawSource());
        return catalog;
    }

    @Bean
    public RollupRouter rollupRouter(RollupCatalog rollupCatalog, RollupCatalogProperties properties) {
        return new RollupRouter(rollupCatalog, properties.getRouter().getDecisionCacheSize());
    }
}
