package com.coursepulse.service.storage.impl;

import com.coursepulse.service.core.model.EventType;
import com.coursepulse.service.core.model.MetricEvent;
import com.coursepulse.service.core.store.MetricsEventRepository;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcMetricsEventRepository implements MetricsEventRepository {

    private static final String INSERT_SQL =
            """
            insert into coursepulse.metrics_events (
                      hour_bucket, event_id, event_type, event_name, user_id, request_id, path, method,
                      status_code, duration_ms, course_id, lesson_id, metadata, created_at
            ) values (
                      :hour_bucket, :event_id, :event_type, :event_name, :user_id, :request_id, :path, :method,
                      :status_code, :duration_ms, :course_id, :lesson_id, cast(:metadata as jsonb), :created_at
            )
            on conflict (hour_bucket, event_id) do nothing
            """;

    private static final String SELECT_SQL =
            """
            select event_id, event_type, event_name, user_id, request_id, path, method, status_code,
                   duration_ms, course_id, lesson_id, metadata::text as metadata, created_at
              from coursepulse.metrics_events
             where hour_bucket = :hour_bucket
               and (cast(:event_type as text) is null or event_type = :event_type)
             order by event_id desc
             limit :limit
            """;

    private final NamedParameterJdbcTemplate jdbc;

    @Override
    public void insert(MetricEvent e) {
        MapSqlParameterSource p = new MapSqlParameterSource()
                .addValue("hour_bucket", e.getHourBucket())
                .addValue("event_id", e.getEventId())
                .addValue("event_type", e.getEventType().value())
                .addValue("event_name", e.getEventName())
                .addValue("user_id", e.getUserId())
                .addValue("request_id", e.getRequestId())
                .addValue("path", e.getPath())
                .addValue("method", e.getMethod())
                .addValue("status_code", e.getStatusCode(), Types.INTEGER)
                .addValue("duration_ms", e.getDurationMs(), Types.DOUBLE)
                .addValue("course_id", e.getCourseId())
                .addValue("lesson_id", e.getLessonId())
                .addValue("metadata", JsonColumns.toJson(e.getMetadata()))
                .addValue(
                        "created_at",
                        OffsetDateTime.ofInstant(e.getCreatedAt(), ZoneOffset.UTC),
                        Types.TIMESTAMP_WITH_TIMEZONE);
        jdbc.update(INSERT_SQL, p);
    }

    @Override
    public List<MetricEvent> findByHourBucket(String hourBucket, EventType eventType, int limit) {
        MapSqlParameterSource p = new MapSqlParameterSource()
                .addValue("hour_bucket", hourBucket)
                .addValue("event_type", eventType == null ? null : eventType.value(), Types.VARCHAR)
                .addValue("limit", limit);
        return jdbc.query(SELECT_SQL, p, (rs, rowNum) -> mapEvent(rs));
    }

    static MetricEvent mapEvent(ResultSet rs) throws SQLException {
        return MetricEvent.builder(EventType.fromValue(rs.getString("event_type")), rs.getString("event_name"))
                .eventId(rs.getObject("event_id", UUID.class))
                .userId(rs.getObject("user_id", UUID.class))
                .requestId(rs.getString("request_id"))
                .path(rs.getString("path"))
                .method(rs.getString("method"))
                .statusCode(rs.getObject("status_code", Integer.class))
                .durationMs(rs.getObject("duration_ms", Double.class))
                .courseId(rs.getObject("course_id", UUID.class))
                .lessonId(rs.getObject("lesson_id", UUID.class))
                .metadata(JsonColumns.toMap(rs.getString("metadata")))
                .createdAt(rs.getObject("created_at", OffsetDateTime.class).toInstant())
                .build();
    }
}
