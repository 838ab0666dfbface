package com.rollupquery.domain.model;

public enum TimeGranularity {
    MINUTE,
    HOUR,
    DAY,
    WEEK
}
