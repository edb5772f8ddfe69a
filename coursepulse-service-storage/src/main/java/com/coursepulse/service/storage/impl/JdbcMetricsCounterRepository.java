package com.coursepulse.service.storage.impl;

import com.coursepulse.service.core.store.MetricsCounterRepository;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** Durable counters incremented atomically by the database. */
@Repository
@RequiredArgsConstructor
public class JdbcMetricsCounterRepository implements MetricsCounterRepository {

    private static final String INCREMENT_SQL =
            """
            insert into coursepulse.metrics_counters as t (counter_key, count, updated_at)
            values (:counter_key, :delta, now())
            on conflict (counter_key)
            do update set
              count = t.count + excluded.count,
              updated_at = now()
            """;

    private static final String GET_SQL =
            "select count from coursepulse.metrics_counters where counter_key = :counter_key";

    private final NamedParameterJdbcTemplate jdbc;

    @Override
    public void increment(String counterKey, long delta) {
        jdbc.update(
                INCREMENT_SQL,
                new MapSqlParameterSource()
                        .addValue("counter_key", counterKey)
                        .addValue("delta", delta));
    }

    @Override
    public long get(String counterKey) {
        List<Long> values = jdbc.queryForList(
                GET_SQL, new MapSqlParameterSource("counter_key", counterKey), Long.class);
        return values.isEmpty() || values.get(0) == null ? 0L : values.get(0);
    }
}
