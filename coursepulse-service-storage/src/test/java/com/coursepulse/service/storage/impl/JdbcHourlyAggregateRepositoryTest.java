package com.coursepulse.service.storage.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.coursepulse.service.core.model.AggregateStats;
import com.coursepulse.service.core.model.HourlyAggregate;
import java.sql.ResultSet;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

class JdbcHourlyAggregateRepositoryTest {

    private final NamedParameterJdbcTemplate jdbc = mock(NamedParameterJdbcTemplate.class);
    private final JdbcHourlyAggregateRepository repository = new JdbcHourlyAggregateRepository(jdbc);

    @Test
    void upsertOverwritesWithMergedTotals() {
        HourlyAggregate row = new HourlyAggregate(
                "2024-03-05",
                14,
                "api_request",
                "3f2a9c0d11e4b7a2",
                Map.of("status", "200"),
                new AggregateStats(3, 45.0, 10.0, 20.0));

        repository.upsert(row);

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
        verify(jdbc).update(sql.capture(), params.capture());

        assertThat(sql.getValue())
                .contains("on conflict (day_bucket, hour, metric_name, dimension_key)")
                .contains("count = excluded.count");
        MapSqlParameterSource p = (MapSqlParameterSource) params.getValue();
        assertThat(p.getValue("day_bucket")).isEqualTo("2024-03-05");
        assertThat(p.getValue("hour")).isEqualTo(14);
        assertThat(p.getValue("count")).isEqualTo(3L);
        assertThat(p.getValue("sum_value")).isEqualTo(45.0);
        assertThat(p.getValue("min_value")).isEqualTo(10.0);
        assertThat(p.getValue("dimensions")).isEqualTo("{\"status\":\"200\"}");
    }

    @Test
    void findReturnsEmptyWhenNoRow() {
        when(jdbc.query(anyString(), any(SqlParameterSource.class), any(RowMapper.class)))
                .thenReturn(List.of());

        assertThat(repository.find("2024-03-05", 1, "api_request", "default")).isEmpty();
    }

    @Test
    void mapsNullMinAndMaxForValuelessRows() throws Exception {
        ResultSet rs = mock(ResultSet.class);
        when(rs.getString("day_bucket")).thenReturn("2024-03-05");
        when(rs.getInt("hour")).thenReturn(9);
        when(rs.getString("metric_name")).thenReturn("user_login");
        when(rs.getString("dimension_key")).thenReturn("default");
        when(rs.getString("dimensions")).thenReturn("{}");
        when(rs.getLong("count")).thenReturn(4L);
        when(rs.getDouble("sum_value")).thenReturn(0.0);
        when(rs.getObject("min_value", Double.class)).thenReturn(null);
        when(rs.getObject("max_value", Double.class)).thenReturn(null);

        HourlyAggregate row = JdbcHourlyAggregateRepository.mapRow(rs);

        assertThat(row.hour()).isEqualTo(9);
        assertThat(row.dimensions()).isEmpty();
        assertThat(row.stats().count()).isEqualTo(4);
        assertThat(row.stats().minValue()).isNull();
        assertThat(row.stats().maxValue()).isNull();
    }
}
