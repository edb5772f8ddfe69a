package com.coursepulse.service.core.query;

import java.util.Locale;

public enum Granularity {
    HOURLY,
    DAILY;

    public static Granularity fromValue(String value) {
        if (value == null || value.isBlank()) {
            return HOURLY;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "hourly", "hour", "1h" -> HOURLY;
            case "daily", "day", "1d" -> DAILY;
            default -> throw new IllegalArgumentException("Unsupported granularity: " + value);
        };
    }
}
