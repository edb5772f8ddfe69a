package com.coursepulse.service.core.query;

import java.util.List;
import java.util.Map;

/** Request breakdown of a day. Percentiles are not tracked and always {@code null}. */
public record RequestMetrics(
        long totalRequests,
        long successRequests,
        long errorRequests,
        Map<String, Long> requestsByStatus,
        Map<String, Long> requestsByMethod,
        double avgResponseTimeMs,
        Double minResponseTimeMs,
        Double maxResponseTimeMs,
        Double p50ResponseTimeMs,
        Double p95ResponseTimeMs,
        Double p99ResponseTimeMs,
        List<EndpointStats> slowestEndpoints,
        List<EndpointStats> busiestEndpoints) {}
