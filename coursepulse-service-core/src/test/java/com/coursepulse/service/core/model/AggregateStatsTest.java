package com.coursepulse.service.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class AggregateStatsTest {

    @Test
    void mergeIsNullSafeForExtremes() {
        AggregateStats noValues = new AggregateStats(3, 0.0, null, null);
        AggregateStats withValues = new AggregateStats(2, 30.0, 10.0, 20.0);

        AggregateStats merged = noValues.merge(withValues);

        assertEquals(5, merged.count());
        assertEquals(30.0, merged.sumValue());
        assertEquals(10.0, merged.minValue());
        assertEquals(20.0, merged.maxValue());
        assertThat(withValues.merge(noValues)).isEqualTo(merged);
    }

    @Test
    void addingNullValueCountsWithoutTouchingExtremes() {
        AggregateStats stats = AggregateStats.EMPTY.add(null).add(12.5).add(null);

        assertThat(stats.count()).isEqualTo(3);
        assertThat(stats.sumValue()).isEqualTo(12.5);
        assertThat(stats.minValue()).isEqualTo(12.5);
        assertThat(stats.maxValue()).isEqualTo(12.5);
    }

    @Test
    void averageGuardsAgainstZeroCount() {
        assertThat(AggregateStats.EMPTY.average()).isZero();
        assertThat(new AggregateStats(4, 10.0, 1.0, 4.0).average()).isEqualTo(2.5);
    }

    @Test
    void rejectsInconsistentValues() {
        assertThrows(IllegalArgumentException.class, () -> new AggregateStats(-1, 0.0, null, null));
        assertThrows(IllegalArgumentException.class, () -> new AggregateStats(1, 0.0, 5.0, 1.0));
    }
}
