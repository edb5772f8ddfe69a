package com.coursepulse.service.storage.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.coursepulse.service.core.model.EventNames;
import com.coursepulse.service.core.model.EventType;
import com.coursepulse.service.core.model.MetricEvent;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

class JdbcMetricsEventRepositoryTest {

    private final NamedParameterJdbcTemplate jdbc = mock(NamedParameterJdbcTemplate.class);
    private final JdbcMetricsEventRepository repository = new JdbcMetricsEventRepository(jdbc);

    @Test
    void insertIsIdempotentPerEventId() {
        UUID user = UUID.randomUUID();
        MetricEvent event = MetricEvent.builder(EventType.REQUEST, EventNames.API_REQUEST)
                .method("GET")
                .path("/api/v1/courses/:id")
                .statusCode(200)
                .durationMs(12.5)
                .userId(user)
                .putMetadata("status_group", "2xx")
                .createdAt(Instant.parse("2024-03-05T14:22:10Z"))
                .build();

        repository.insert(event);

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
        verify(jdbc).update(sql.capture(), params.capture());

        assertThat(sql.getValue()).contains("on conflict (hour_bucket, event_id) do nothing");
        MapSqlParameterSource p = (MapSqlParameterSource) params.getValue();
        assertThat(p.getValue("hour_bucket")).isEqualTo("2024-03-05-14");
        assertThat(p.getValue("event_id")).isEqualTo(event.getEventId());
        assertThat(p.getValue("event_type")).isEqualTo("request");
        assertThat(p.getValue("status_code")).isEqualTo(200);
        assertThat(p.getValue("user_id")).isEqualTo(user);
        assertThat(p.getValue("metadata")).isEqualTo("{\"status_group\":\"2xx\"}");
        assertThat(p.getValue("created_at")).isEqualTo(OffsetDateTime.parse("2024-03-05T14:22:10Z"));
    }
}
