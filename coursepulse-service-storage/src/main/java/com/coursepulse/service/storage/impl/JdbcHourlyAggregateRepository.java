package com.coursepulse.service.storage.impl;

import com.coursepulse.service.core.model.AggregateStats;
import com.coursepulse.service.core.model.HourlyAggregate;
import com.coursepulse.service.core.store.HourlyAggregateRepository;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Hourly aggregate rows. The collector writes merged totals, so the upsert overwrites rather than
 * adding; a deployment with several writers would need the delta form
 * ({@code count = t.count + excluded.count}) instead.
 */
@Repository
@RequiredArgsConstructor
public class JdbcHourlyAggregateRepository implements HourlyAggregateRepository {

    private static final String COLUMNS =
            "day_bucket, hour, metric_name, dimension_key, dimensions::text as dimensions, count, sum_value, min_value, max_value";

    private static final String FIND_SQL = "select " + COLUMNS
            + """
             from coursepulse.metrics_hourly
            where day_bucket = :day_bucket and hour = :hour
              and metric_name = :metric_name and dimension_key = :dimension_key
            """;

    private static final String BY_DAY_SQL = "select " + COLUMNS
            + """
             from coursepulse.metrics_hourly
            where day_bucket = :day_bucket
            order by hour, metric_name, dimension_key
            """;

    private static final String BY_DAY_AND_METRIC_SQL = "select " + COLUMNS
            + """
             from coursepulse.metrics_hourly
            where day_bucket = :day_bucket and metric_name = :metric_name
            order by hour, dimension_key
            """;

    private static final String UPSERT_SQL =
            """
            insert into coursepulse.metrics_hourly as t
              (day_bucket, hour, metric_name, dimension_key, dimensions, count, sum_value, min_value, max_value, updated_at)
            values
              (:day_bucket, :hour, :metric_name, :dimension_key, cast(:dimensions as jsonb), :count, :sum_value, :min_value, :max_value, now())
            on conflict (day_bucket, hour, metric_name, dimension_key)
            do update set
              dimensions = excluded.dimensions,
              count = excluded.count,
              sum_value = excluded.sum_value,
              min_value = excluded.min_value,
              max_value = excluded.max_value,
              updated_at = now()
            """;

    private final NamedParameterJdbcTemplate jdbc;

    @Override
    public Optional<HourlyAggregate> find(String dayBucket, int hour, String metricName, String dimensionKey) {
        MapSqlParameterSource p = new MapSqlParameterSource()
                .addValue("day_bucket", dayBucket)
                .addValue("hour", hour)
                .addValue("metric_name", metricName)
                .addValue("dimension_key", dimensionKey);
        return jdbc.query(FIND_SQL, p, (rs, rowNum) -> mapRow(rs)).stream().findFirst();
    }

    @Override
    public void upsert(HourlyAggregate a) {
        AggregateStats s = a.stats();
        MapSqlParameterSource p = new MapSqlParameterSource()
                .addValue("day_bucket", a.dayBucket())
                .addValue("hour", a.hour())
                .addValue("metric_name", a.metricName())
                .addValue("dimension_key", a.dimensionKey())
                .addValue("dimensions", JsonColumns.toJson(a.dimensions()))
                .addValue("count", s.count())
                .addValue("sum_value", s.sumValue())
                .addValue("min_value", s.minValue(), Types.DOUBLE)
                .addValue("max_value", s.maxValue(), Types.DOUBLE);
        jdbc.update(UPSERT_SQL, p);
    }

    @Override
    public List<HourlyAggregate> findByDay(String dayBucket) {
        return jdbc.query(
                BY_DAY_SQL, new MapSqlParameterSource("day_bucket", dayBucket), (rs, rowNum) -> mapRow(rs));
    }

    @Override
    public List<HourlyAggregate> findByDayAndMetric(String dayBucket, String metricName) {
        MapSqlParameterSource p = new MapSqlParameterSource()
                .addValue("day_bucket", dayBucket)
                .addValue("metric_name", metricName);
        return jdbc.query(BY_DAY_AND_METRIC_SQL, p, (rs, rowNum) -> mapRow(rs));
    }

    static HourlyAggregate mapRow(ResultSet rs) throws SQLException {
        return new HourlyAggregate(
                rs.getString("day_bucket"),
                rs.getInt("hour"),
                rs.getString("metric_name"),
                rs.getString("dimension_key"),
                JsonColumns.toMap(rs.getString("dimensions")),
                new AggregateStats(
                        rs.getLong("count"),
                        rs.getDouble("sum_value"),
                        rs.getObject("min_value", Double.class),
                        rs.getObject("max_value", Double.class)));
    }
}
