package com.coursepulse.service.core.model;

import java.util.Map;

/** One row of hourly pre-aggregated statistics keyed by {@code (dayBucket, hour, metricName, dimensionKey)}. */
public record HourlyAggregate(
        String dayBucket,
        int hour,
        String metricName,
        String dimensionKey,
        Map<String, String> dimensions,
        AggregateStats stats) {

    public HourlyAggregate {
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("hour must be in [0, 23]: " + hour);
        }
        dimensions = dimensions == null ? Map.of() : Map.copyOf(dimensions);
        stats = stats == null ? AggregateStats.EMPTY : stats;
    }

    public HourlyAggregate withStats(AggregateStats newStats) {
        return new HourlyAggregate(dayBucket, hour, metricName, dimensionKey, dimensions, newStats);
    }

    public long count() {
        return stats.count();
    }
}
