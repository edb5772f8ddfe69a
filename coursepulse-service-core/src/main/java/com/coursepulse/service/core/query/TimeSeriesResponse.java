package com.coursepulse.service.core.query;

import java.time.Instant;
import java.util.List;

public record TimeSeriesResponse(
        String metricName,
        Granularity granularity,
        Instant startTime,
        Instant endTime,
        List<TimeSeriesPoint> data,
        long totalCount,
        double avgValue) {}
