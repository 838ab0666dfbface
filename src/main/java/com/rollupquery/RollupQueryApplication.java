package com.rollupquery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Rollup Query Service
 *
 * Answers count/sum/avg queries over the ad event log from the smallest
 * pre-aggregated rollup that can answer them correctly.
 *
 * Architecture:
 * - REST API accepting JSON query descriptors
 * - Rollup router choosing among a fixed catalog of materialized rollups
 * - In-memory result cache with LRU eviction, TTL and a byte budget
 * - JDBC storage engine with raw-source fallback when a rollup query fails
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class RollupQueryApplication {

    public static void main(String[] args) {
        SpringApplication.run(RollupQueryApplication.class, args);
    }
}
