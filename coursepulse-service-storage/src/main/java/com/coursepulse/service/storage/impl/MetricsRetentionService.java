package com.coursepulse.service.storage.impl;

import com.coursepulse.service.core.config.MetricsProperties;
import com.coursepulse.service.core.model.MetricBuckets;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Expires old metrics rows. Raw events are kept for days, hourly rows for months and daily rows
 * for years; counters follow the hourly window since their keys are hour scoped.
 */
@Service
@ConditionalOnProperty(prefix = "coursepulse.metrics.retention", name = "enabled", matchIfMissing = true)
public class MetricsRetentionService {

    private static final Logger log = LoggerFactory.getLogger(MetricsRetentionService.class);

    private static final String DELETE_EVENTS_SQL =
            "delete from coursepulse.metrics_events where created_at < :cutoff";

    private static final String DELETE_HOURLY_SQL =
            "delete from coursepulse.metrics_hourly where day_bucket < :cutoff_day";

    // month_bucket is yyyy-MM so the row date is rebuilt before comparing
    private static final String DELETE_DAILY_SQL =
            """
            delete from coursepulse.metrics_daily
             where to_date(month_bucket || '-01', 'YYYY-MM-DD') + (day - 1) < :cutoff_date
            """;

    private static final String DELETE_COUNTERS_SQL =
            "delete from coursepulse.metrics_counters where updated_at < :cutoff";

    private final NamedParameterJdbcTemplate jdbc;
    private final MetricsProperties.Retention retention;
    private final Clock clock;

    public MetricsRetentionService(NamedParameterJdbcTemplate jdbc, MetricsProperties properties, Clock clock) {
        this.jdbc = jdbc;
        this.retention = properties.getRetention();
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        log.info("Applying metrics retention at startup...");
        purgeExpired();
    }

    /** Runs daily at 02:30 UTC, after the default rollup delay has passed for the previous day. */
    @Scheduled(cron = "0 30 2 * * *", zone = "UTC")
    public void purgeExpired() {
        Instant now = clock.instant();
        try {
            int events = jdbc.update(DELETE_EVENTS_SQL, cutoff(now, retention.getRawEvents()));

            LocalDate hourlyCutoff = MetricBuckets.utcDate(now.minus(retention.getHourly()));
            int hourly = jdbc.update(
                    DELETE_HOURLY_SQL,
                    new MapSqlParameterSource("cutoff_day", MetricBuckets.dayBucket(hourlyCutoff)));

            LocalDate dailyCutoff = MetricBuckets.utcDate(now.minus(retention.getDaily()));
            int daily = jdbc.update(
                    DELETE_DAILY_SQL, new MapSqlParameterSource().addValue("cutoff_date", dailyCutoff, Types.DATE));

            int counters = jdbc.update(DELETE_COUNTERS_SQL, cutoff(now, retention.getHourly()));

            log.info(
                    "Metrics retention purged events={} hourly={} daily={} counters={}",
                    events,
                    hourly,
                    daily,
                    counters);
        } catch (RuntimeException ex) {
            log.error("Metrics retention run failed", ex);
        }
    }

    private static MapSqlParameterSource cutoff(Instant now, Duration keep) {
        return new MapSqlParameterSource()
                .addValue(
                        "cutoff",
                        OffsetDateTime.ofInstant(now.minus(keep), ZoneOffset.UTC),
                        Types.TIMESTAMP_WITH_TIMEZONE);
    }
}
