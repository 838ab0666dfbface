package com.rollupquery.domain.model;

import java.util.Locale;

/**
 * Aggregate functions a rollup can answer. Everything else is OTHER.
 */
public enum AggregateFunction {
    COUNT,
    SUM,
    AVG,
    OTHER;

    public static AggregateFunction fromName(String name) {
        if (name == null) {
            return OTHER;
        }
        return switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "COUNT" -> COUNT;
            case "SUM" -> SUM;
            case "AVG" -> AVG;
            default -> OTHER;
        };
    }

    public boolean isRollupCompatible() {
        return this != OTHER;
    }
}
