package com.coursepulse.service.core.model;

/**
 * Count, sum and extremes of an aggregated value. Extremes are {@code null} until a value has been
 * observed, so {@code count == 0} implies both are {@code null}.
 */
public record AggregateStats(long count, double sumValue, Double minValue, Double maxValue) {

    public static final AggregateStats EMPTY = new AggregateStats(0L, 0.0, null, null);

    public AggregateStats {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0");
        }
        if (minValue != null && maxValue != null && minValue > maxValue) {
            throw new IllegalArgumentException("minValue " + minValue + " > maxValue " + maxValue);
        }
    }

    /** Stats of one occurrence; a {@code null} value counts without touching sum or extremes. */
    public static AggregateStats of(Double value) {
        return value == null ? new AggregateStats(1L, 0.0, null, null) : new AggregateStats(1L, value, value, value);
    }

    public AggregateStats merge(AggregateStats other) {
        if (other == null) {
            return this;
        }
        return new AggregateStats(
                count + other.count,
                sumValue + other.sumValue,
                nullSafeMin(minValue, other.minValue),
                nullSafeMax(maxValue, other.maxValue));
    }

    public AggregateStats add(Double value) {
        return merge(of(value));
    }

    /** {@code sum / max(count, 1)}. */
    public double average() {
        return sumValue / Math.max(count, 1L);
    }

    public static Double nullSafeMin(Double a, Double b) {
        if (a == null) return b;
        if (b == null) return a;
        return Math.min(a, b);
    }

    public static Double nullSafeMax(Double a, Double b) {
        if (a == null) return b;
        if (b == null) return a;
        return Math.max(a, b);
    }
}
