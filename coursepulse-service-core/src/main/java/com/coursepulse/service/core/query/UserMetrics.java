package com.coursepulse.service.core.query;

import java.util.Map;

/**
 * Login activity. {@code totalActive} and {@code uniqueLogins} need distinct-user tracking, which
 * the hourly aggregates do not carry, so they are {@code null}.
 */
public record UserMetrics(
        Long totalActive, long newRegistrations, long logins, Long uniqueLogins, Map<String, Long> byHour) {}
