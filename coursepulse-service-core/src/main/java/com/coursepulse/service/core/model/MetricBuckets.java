package com.coursepulse.service.core.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * UTC time bucket labels used as partition keys.
 *
 * <ul>
 *   <li>hour bucket: {@code yyyy-MM-dd-HH}
 *   <li>day bucket: {@code yyyy-MM-dd}
 *   <li>month bucket: {@code yyyy-MM}
 * </ul>
 */
public final class MetricBuckets {

    private static final DateTimeFormatter HOUR = DateTimeFormatter.ofPattern("yyyy-MM-dd-HH");
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyy-MM");

    private MetricBuckets() {}

    public static String hourBucket(Instant instant) {
        return HOUR.format(utc(instant));
    }

    public static String dayBucket(Instant instant) {
        return DAY.format(utc(instant));
    }

    public static String dayBucket(LocalDate day) {
        return DAY.format(day);
    }

    public static String monthBucket(Instant instant) {
        return MONTH.format(utc(instant));
    }

    public static String monthBucket(LocalDate day) {
        return MONTH.format(day);
    }

    public static int hourOfDay(Instant instant) {
        return utc(instant).getHour();
    }

    public static Instant truncateToDay(Instant instant) {
        return instant.truncatedTo(ChronoUnit.DAYS);
    }

    public static LocalDate utcDate(Instant instant) {
        return utc(instant).toLocalDate();
    }

    /** Start of {@code hour} on the day named by {@code dayBucket}. */
    public static Instant hourStart(String dayBucket, int hour) {
        return parseDay(dayBucket).atTime(hour, 0).toInstant(ZoneOffset.UTC);
    }

    /** Start of {@code day} in the month named by {@code monthBucket}. */
    public static Instant dayStart(String monthBucket, int day) {
        try {
            return YearMonth.parse(monthBucket, MONTH).atDay(day).atStartOfDay().toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Invalid month bucket: " + monthBucket, ex);
        }
    }

    public static LocalDate parseDay(String dayBucket) {
        try {
            return LocalDate.parse(dayBucket, DAY);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Invalid day bucket: " + dayBucket, ex);
        }
    }

    private static LocalDateTime utc(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
