package com.coursepulse.service.storage.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

class JdbcMetricsCounterRepositoryTest {

    private final NamedParameterJdbcTemplate jdbc = mock(NamedParameterJdbcTemplate.class);
    private final JdbcMetricsCounterRepository repository = new JdbcMetricsCounterRepository(jdbc);

    @Test
    void incrementAddsInTheDatabase() {
        repository.increment("2024-03-05-14:request:total", 150);

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
        verify(jdbc).update(sql.capture(), params.capture());

        assertThat(sql.getValue()).contains("count = t.count + excluded.count");
        MapSqlParameterSource p = (MapSqlParameterSource) params.getValue();
        assertThat(p.getValue("counter_key")).isEqualTo("2024-03-05-14:request:total");
        assertThat(p.getValue("delta")).isEqualTo(150L);
    }

    @Test
    void missingCounterReadsAsZero() {
        when(jdbc.queryForList(anyString(), any(SqlParameterSource.class), eq(Long.class)))
                .thenReturn(List.of());

        assertThat(repository.get("nope")).isZero();
    }

    @Test
    void existingCounterIsReturned() {
        when(jdbc.queryForList(anyString(), any(SqlParameterSource.class), eq(Long.class)))
                .thenReturn(List.of(42L));

        assertThat(repository.get("2024-03-05-14:api_request")).isEqualTo(42L);
    }
}
