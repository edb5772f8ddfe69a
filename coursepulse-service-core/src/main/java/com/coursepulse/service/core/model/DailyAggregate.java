package com.coursepulse.service.core.model;

import java.util.Map;

/** Daily rollup of hourly rows keyed by {@code (monthBucket, day, metricName, dimensionKey)}. */
public record DailyAggregate(
        String monthBucket,
        int day,
        String metricName,
        String dimensionKey,
        Map<String, String> dimensions,
        AggregateStats stats) {

    public DailyAggregate {
        if (day < 1 || day > 31) {
            throw new IllegalArgumentException("day must be in [1, 31]: " + day);
        }
        dimensions = dimensions == null ? Map.of() : Map.copyOf(dimensions);
        stats = stats == null ? AggregateStats.EMPTY : stats;
    }

    public long count() {
        return stats.count();
    }
}
