package com.coursepulse.service.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable metric event as produced by the ingress adapters and stored in the raw event table.
 * Optional fields are {@code null} when absent; {@link #getMetadata()} is never {@code null}.
 */
public final class MetricEvent {

    // -------- Identity
    private final UUID eventId; // time ordered
    private final EventType eventType;
    private final String eventName;
    private final String hourBucket; // derived from createdAt

    // -------- Actor
    private final UUID userId;
    private final String requestId;

    // -------- Request surface
    private final String path;
    private final String method;
    private final Integer statusCode;
    private final Double durationMs;

    // -------- Business surface
    private final UUID courseId;
    private final UUID lessonId;

    private final Map<String, String> metadata;
    private final Instant createdAt;

    private MetricEvent(Builder b) {
        this.eventType = Objects.requireNonNull(b.eventType, "eventType");
        this.eventName = Objects.requireNonNull(b.eventName, "eventName");
        this.createdAt = b.createdAt != null ? b.createdAt : Instant.now();
        this.eventId = b.eventId != null ? b.eventId : TimeOrderedIds.next();
        this.hourBucket = MetricBuckets.hourBucket(createdAt);
        this.userId = b.userId;
        this.requestId = b.requestId;
        this.path = b.path;
        this.method = b.method;
        this.statusCode = b.statusCode;
        this.durationMs = b.durationMs;
        this.courseId = b.courseId;
        this.lessonId = b.lessonId;
        this.metadata = b.metadata == null || b.metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata));
    }

    public static Builder builder(EventType eventType, String eventName) {
        return new Builder().eventType(eventType).eventName(eventName);
    }

    public static final class Builder {
        private UUID eventId;
        private EventType eventType;
        private String eventName;
        private UUID userId;
        private String requestId;
        private String path;
        private String method;
        private Integer statusCode;
        private Double durationMs;
        private UUID courseId;
        private UUID lessonId;
        private Map<String, String> metadata;
        private Instant createdAt;

        public Builder eventId(UUID v) {
            this.eventId = v;
            return this;
        }

        public Builder eventType(EventType v) {
            this.eventType = v;
            return this;
        }

        public Builder eventName(String v) {
            this.eventName = v;
            return this;
        }

        public Builder userId(UUID v) {
            this.userId = v;
            return this;
        }

        public Builder requestId(String v) {
            this.requestId = v;
            return this;
        }

        public Builder path(String v) {
            this.path = v;
            return this;
        }

        public Builder method(String v) {
            this.method = v;
            return this;
        }

        public Builder statusCode(Integer v) {
            this.statusCode = v;
            return this;
        }

        public Builder durationMs(Double v) {
            this.durationMs = v;
            return this;
        }

        public Builder courseId(UUID v) {
            this.courseId = v;
            return this;
        }

        public Builder lessonId(UUID v) {
            this.lessonId = v;
            return this;
        }

        public Builder metadata(Map<String, String> v) {
            this.metadata = v;
            return this;
        }

        public Builder putMetadata(String key, String value) {
            if (this.metadata == null) {
                this.metadata = new LinkedHashMap<>();
            } else if (!(this.metadata instanceof LinkedHashMap)) {
                this.metadata = new LinkedHashMap<>(this.metadata);
            }
            this.metadata.put(key, value);
            return this;
        }

        public Builder createdAt(Instant v) {
            this.createdAt = v;
            return this;
        }

        public MetricEvent build() {
            return new MetricEvent(this);
        }
    }

    // ---------- Getters

    public UUID getEventId() {
        return eventId;
    }

    public EventType getEventType() {
        return eventType;
    }

    public String getEventName() {
        return eventName;
    }

    public String getHourBucket() {
        return hourBucket;
    }

    public UUID getUserId() {
        return userId;
    }

    public String getRequestId() {
        return requestId;
    }

    public String getPath() {
        return path;
    }

    public String getMethod() {
        return method;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public Double getDurationMs() {
        return durationMs;
    }

    public UUID getCourseId() {
        return courseId;
    }

    public UUID getLessonId() {
        return lessonId;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "MetricEvent{" + eventType.value() + ":" + eventName + ", id=" + eventId + ", at=" + createdAt + "}";
    }
}
