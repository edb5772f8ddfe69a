package com.coursepulse.service.storage.impl;

import com.coursepulse.service.core.model.AggregateStats;
import com.coursepulse.service.core.model.DailyAggregate;
import com.coursepulse.service.core.store.DailyAggregateRepository;
import java.sql.Types;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcDailyAggregateRepository implements DailyAggregateRepository {

    private static final String UPSERT_SQL =
            """
            insert into coursepulse.metrics_daily as t
              (month_bucket, day, metric_name, dimension_key, dimensions, count, sum_value, min_value, max_value, updated_at)
            values
              (:month_bucket, :day, :metric_name, :dimension_key, cast(:dimensions as jsonb), :count, :sum_value, :min_value, :max_value, now())
            on conflict (month_bucket, day, metric_name, dimension_key)
            do update set
              dimensions = excluded.dimensions,
              count = excluded.count,
              sum_value = excluded.sum_value,
              min_value = excluded.min_value,
              max_value = excluded.max_value,
              updated_at = now()
            """;

    private static final String BY_MONTH_SQL =
            """
            select month_bucket, day, metric_name, dimension_key, dimensions::text as dimensions,
                   count, sum_value, min_value, max_value
              from coursepulse.metrics_daily
             where month_bucket = :month_bucket
             order by day, metric_name, dimension_key
            """;

    private final NamedParameterJdbcTemplate jdbc;

    @Override
    public void upsert(DailyAggregate a) {
        AggregateStats s = a.stats();
        MapSqlParameterSource p = new MapSqlParameterSource()
                .addValue("month_bucket", a.monthBucket())
                .addValue("day", a.day())
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
    public List<DailyAggregate> findByMonth(String monthBucket) {
        return jdbc.query(
                BY_MONTH_SQL,
                new MapSqlParameterSource("month_bucket", monthBucket),
                (rs, rowNum) -> new DailyAggregate(
                        rs.getString("month_bucket"),
                        rs.getInt("day"),
                        rs.getString("metric_name"),
                        rs.getString("dimension_key"),
                        JsonColumns.toMap(rs.getString("dimensions")),
                        new AggregateStats(
                                rs.getLong("count"),
                                rs.getDouble("sum_value"),
                                rs.getObject("min_value", Double.class),
                                rs.getObject("max_value", Double.class))));
    }
}
