package com.coursepulse.service.core.query;

import java.time.Instant;

/**
 * Summary tiles of the admin dashboard. {@code activeUsers} counts logins, not distinct users.
 * Trends are percentage changes against the preceding day.
 */
public record DashboardMetrics(
        Period period,
        Instant periodStart,
        Instant periodEnd,
        long requestsTotal,
        long requestsSuccess,
        long requestsError,
        double avgResponseTimeMs,
        Double maxResponseTimeMs,
        long activeUsers,
        long newUsers,
        long enrollments,
        long completions,
        long comments,
        double requestsTrend,
        double usersTrend,
        double enrollmentsTrend,
        Instant generatedAt) {}
