package com.coursepulse.service.core.query;

/** Compact status line built from durable counters of the current hour. */
public record MetricsSummary(
        long requestsLastHour,
        long errorsLastHour,
        double avgResponseMs,
        long activeUsersToday,
        int queueSize,
        int queueCapacity,
        String workerStatus) {}
