package com.coursepulse.service.core.query;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/** Named reporting windows, all evaluated in UTC. */
public enum Period {
    TODAY,
    YESTERDAY,
    WEEK,
    MONTH,
    CUSTOM;

    /**
     * Resolves the window relative to {@code now}. {@code start} and {@code end} are only read for
     * {@link #CUSTOM}, where both are required.
     */
    public TimeRange resolve(Instant now, Instant start, Instant end) {
        Instant midnight = now.truncatedTo(ChronoUnit.DAYS);
        return switch (this) {
            case TODAY -> new TimeRange(midnight, now);
            case YESTERDAY -> new TimeRange(midnight.minus(Duration.ofDays(1)), midnight);
            case WEEK -> new TimeRange(now.minus(Duration.ofDays(7)), now);
            case MONTH -> new TimeRange(now.minus(Duration.ofDays(30)), now);
            case CUSTOM -> {
                if (start == null || end == null) {
                    throw new IllegalArgumentException("start and end are required for a custom period");
                }
                yield new TimeRange(start, end);
            }
        };
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Period fromValue(String value) {
        if (value == null || value.isBlank()) {
            return TODAY;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported period: " + value, ex);
        }
    }
}
