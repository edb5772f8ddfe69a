package com.coursepulse.service.core.aggregator;

import static com.coursepulse.service.core.support.Waits.waitUntil;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.coursepulse.service.core.model.AggregateStats;
import com.coursepulse.service.core.model.DailyAggregate;
import com.coursepulse.service.core.model.EventNames;
import com.coursepulse.service.core.model.HourlyAggregate;
import com.coursepulse.service.core.support.InMemoryMetricsStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MetricsAggregatorTest {

    private final InMemoryMetricsStore store = new InMemoryMetricsStore();

    @Test
    void rollupSumsHoursPerMetricAndDimension() {
        seed("2024-01-15", 9, EventNames.API_REQUEST, "default", new AggregateStats(2, 30.0, 10.0, 20.0));
        seed("2024-01-15", 10, EventNames.API_REQUEST, "default", new AggregateStats(3, 15.0, 1.0, 9.0));
        seed("2024-01-15", 10, EventNames.USER_LOGIN, "default", new AggregateStats(4, 0.0, null, null));
        seed("2024-01-16", 0, EventNames.API_REQUEST, "default", new AggregateStats(7, 7.0, 1.0, 1.0));
        MetricsAggregator aggregator = aggregator("2024-01-16T01:00:00Z", 2);

        int written = aggregator.runRollup();

        assertThat(written).isEqualTo(2);
        List<DailyAggregate> rows = store.findByMonth("2024-01");
        DailyAggregate requests = find(rows, EventNames.API_REQUEST);
        assertThat(requests.day()).isEqualTo(15);
        assertThat(requests.stats()).isEqualTo(new AggregateStats(5, 45.0, 1.0, 20.0));
        DailyAggregate logins = find(rows, EventNames.USER_LOGIN);
        assertThat(logins.stats().count()).isEqualTo(4);
        assertThat(logins.stats().minValue()).isNull();
    }

    @Test
    void rerunningRollupIsIdempotent() {
        seed("2024-01-15", 9, EventNames.ENROLLMENT_CREATED, "default", new AggregateStats(2, 0.0, null, null));
        MetricsAggregator aggregator = aggregator("2024-01-16T01:00:00Z", 2);

        aggregator.runRollup();
        List<DailyAggregate> first = store.findByMonth("2024-01");
        aggregator.runRollup();
        List<DailyAggregate> second = store.findByMonth("2024-01");

        assertThat(second).containsExactlyInAnyOrderElementsOf(first);
        assertThat(second).hasSize(1);
        assertThat(second.get(0).count()).isEqualTo(2);
    }

    @Test
    void delayMovesTargetToCurrentDayOnceElapsed() {
        seed("2024-01-16", 0, EventNames.API_REQUEST, "default", new AggregateStats(1, 1.0, 1.0, 1.0));

        assertThat(aggregator("2024-01-16T03:00:00Z", 2).runRollup()).isEqualTo(1);
        assertThat(store.findByMonth("2024-01")).extracting(DailyAggregate::day).containsExactly(16);
    }

    @Test
    void backfillRollsUpCompleteDaysBeforeToday() {
        seed("2024-01-13", 5, EventNames.API_REQUEST, "default", new AggregateStats(1, 1.0, 1.0, 1.0));
        seed("2024-01-14", 5, EventNames.API_REQUEST, "default", new AggregateStats(2, 2.0, 1.0, 1.0));
        seed("2024-01-15", 5, EventNames.API_REQUEST, "default", new AggregateStats(3, 3.0, 1.0, 1.0));
        seed("2024-01-16", 0, EventNames.API_REQUEST, "default", new AggregateStats(4, 4.0, 1.0, 1.0));
        seed("2024-01-10", 5, EventNames.API_REQUEST, "default", new AggregateStats(9, 9.0, 1.0, 1.0));
        MetricsAggregator aggregator = aggregator("2024-01-16T12:00:00Z", 2);

        assertThat(aggregator.backfill(3)).isEqualTo(3);
        assertThat(store.findByMonth("2024-01"))
                .extracting(DailyAggregate::day)
                .containsExactlyInAnyOrder(13, 14, 15);
        assertThatThrownBy(() -> aggregator.backfill(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void readFailureWritesNothing() {
        store.failReads = true;
        MetricsAggregator aggregator = aggregator("2024-01-16T01:00:00Z", 2);

        assertThat(aggregator.rollupDay(LocalDate.of(2024, 1, 15))).isZero();
        assertThat(store.dailyUpserts).isZero();
    }

    @Test
    void scheduledCycleRunsImmediatelyAndStops() {
        seed("2024-01-15", 9, EventNames.API_REQUEST, "default", new AggregateStats(1, 1.0, 1.0, 1.0));
        MetricsAggregator aggregator = aggregator("2024-01-16T01:00:00Z", 2);

        aggregator.start(Duration.ofHours(1));
        aggregator.start(Duration.ofHours(1));
        try {
            assertThat(waitUntil(() -> store.dailyUpserts == 1, Duration.ofSeconds(5))).isTrue();
            assertThat(aggregator.isRunning()).isTrue();
        } finally {
            aggregator.stop();
        }
        assertThat(aggregator.isRunning()).isFalse();
        assertThat(aggregator.getLastRollupAt()).isEqualTo(Instant.parse("2024-01-16T01:00:00Z"));
        aggregator.stop();
    }

    private MetricsAggregator aggregator(String now, int delayHours) {
        return new MetricsAggregator(store, store, Clock.fixed(Instant.parse(now), ZoneOffset.UTC), delayHours);
    }

    private void seed(String day, int hour, String metric, String dimensionKey, AggregateStats stats) {
        store.upsert(new HourlyAggregate(day, hour, metric, dimensionKey, Map.of(), stats));
    }

    private static DailyAggregate find(List<DailyAggregate> rows, String metric) {
        return rows.stream()
                .filter(r -> r.metricName().equals(metric))
                .findFirst()
                .orElseThrow();
    }
}
