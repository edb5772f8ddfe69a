package com.coursepulse.service.core.aggregator;

import com.coursepulse.service.core.model.AggregateStats;
import com.coursepulse.service.core.model.DailyAggregate;
import com.coursepulse.service.core.model.HourlyAggregate;
import com.coursepulse.service.core.model.MetricBuckets;
import com.coursepulse.service.core.store.DailyAggregateRepository;
import com.coursepulse.service.core.store.HourlyAggregateRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Rolls hourly aggregates up into daily rows.
 *
 * <p>A scheduled cycle targets the UTC day that was current {@code rollupDelayHours} ago, which
 * leaves late hourly writes time to land before the day is summarized. Daily rows are overwritten,
 * so repeating a rollup over unchanged hourly data produces the same result.
 */
@Slf4j
public class MetricsAggregator {

    static final String THREAD_NAME = "coursepulse-metrics-aggregator";

    private final HourlyAggregateRepository hourlyRepository;
    private final DailyAggregateRepository dailyRepository;
    private final Clock clock;
    private final int rollupDelayHours;

    private final Object lifecycleLock = new Object();
    private final Object rollupLock = new Object();
    private ScheduledExecutorService scheduler;
    private volatile Instant lastRollupAt;

    public MetricsAggregator(
            HourlyAggregateRepository hourlyRepository,
            DailyAggregateRepository dailyRepository,
            Clock clock,
            int rollupDelayHours) {
        if (rollupDelayHours < 0) {
            throw new IllegalArgumentException("rollupDelayHours must be >= 0: " + rollupDelayHours);
        }
        this.hourlyRepository = hourlyRepository;
        this.dailyRepository = dailyRepository;
        this.clock = clock;
        this.rollupDelayHours = rollupDelayHours;
    }

    public void start(Duration interval) {
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
        synchronized (lifecycleLock) {
            if (scheduler != null) {
                log.warn("Metrics aggregator already running");
                return;
            }
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, THREAD_NAME);
                t.setDaemon(true);
                return t;
            });
            scheduler.scheduleWithFixedDelay(this::runCycle, 0L, interval.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Metrics aggregator started interval={} rollupDelayHours={}", interval, rollupDelayHours);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (scheduler == null) {
                return;
            }
            scheduler.shutdownNow();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Metrics aggregator did not terminate within 5s");
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
            scheduler = null;
            log.info("Metrics aggregator stopped lastRollupAt={}", lastRollupAt);
        }
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return scheduler != null;
        }
    }

    private void runCycle() {
        try {
            runRollup();
        } catch (Exception ex) {
            log.error("Metrics rollup cycle failed", ex);
        }
    }

    /** Rolls up the day that was current {@code rollupDelayHours} ago. */
    public int runRollup() {
        Instant target = clock.instant().minus(Duration.ofHours(rollupDelayHours));
        return rollupDay(MetricBuckets.utcDate(target));
    }

    /**
     * Summarizes every hourly row of {@code day} into one daily row per metric and dimension key.
     *
     * @return number of daily rows written
     */
    public int rollupDay(LocalDate day) {
        String dayBucket = MetricBuckets.dayBucket(day);
        synchronized (rollupLock) {
            List<HourlyAggregate> hourly;
            try {
                hourly = hourlyRepository.findByDay(dayBucket);
            } catch (Exception ex) {
                log.error("Failed to read hourly aggregates for rollup day={}", dayBucket, ex);
                return 0;
            }

            Map<String, DailyAggregate> daily = new LinkedHashMap<>();
            String monthBucket = MetricBuckets.monthBucket(day);
            for (HourlyAggregate row : hourly) {
                String key = row.metricName() + "\u0000" + row.dimensionKey();
                daily.merge(
                        key,
                        new DailyAggregate(
                                monthBucket,
                                day.getDayOfMonth(),
                                row.metricName(),
                                row.dimensionKey(),
                                row.dimensions(),
                                row.stats()),
                        MetricsAggregator::combine);
            }

            int written = 0;
            for (DailyAggregate row : daily.values()) {
                try {
                    dailyRepository.upsert(row);
                    written++;
                } catch (Exception ex) {
                    log.error(
                            "Failed to write daily aggregate day={} metric={} dimensionKey={}",
                            dayBucket,
                            row.metricName(),
                            row.dimensionKey(),
                            ex);
                }
            }
            lastRollupAt = clock.instant();
            log.info("Metrics rollup complete day={} hourlyRows={} dailyRows={}", dayBucket, hourly.size(), written);
            return written;
        }
    }

    /**
     * Rolls up the {@code days} complete UTC days before today, without applying the delay.
     *
     * @return total number of daily rows written
     */
    public int backfill(int days) {
        if (days < 0) {
            throw new IllegalArgumentException("days must be >= 0: " + days);
        }
        LocalDate today = MetricBuckets.utcDate(clock.instant());
        int total = 0;
        for (int i = 1; i <= days; i++) {
            total += rollupDay(today.minusDays(i));
        }
        log.info("Metrics backfill complete days={} dailyRows={}", days, total);
        return total;
    }

    public Instant getLastRollupAt() {
        return lastRollupAt;
    }

    private static DailyAggregate combine(DailyAggregate a, DailyAggregate b) {
        AggregateStats stats = a.stats().merge(b.stats());
        return new DailyAggregate(a.monthBucket(), a.day(), a.metricName(), a.dimensionKey(), a.dimensions(), stats);
    }
}
