package com.coursepulse.service.core.query;

public record BusinessMetrics(
        long enrollments,
        long completions,
        long courseCompletions,
        long comments,
        long reactions,
        long newUsers,
        long activeUsers) {}
