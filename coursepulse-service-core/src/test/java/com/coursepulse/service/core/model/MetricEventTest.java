package com.coursepulse.service.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class MetricEventTest {

    @Test
    void derivesHourBucketAndDefaultsOptionalFields() {
        MetricEvent event = MetricEvent.builder(EventType.BUSINESS, EventNames.ENROLLMENT_CREATED)
                .createdAt(Instant.parse("2024-01-15T23:59:59Z"))
                .build();

        assertThat(event.getHourBucket()).isEqualTo("2024-01-15-23");
        assertThat(event.getEventId()).isNotNull();
        assertThat(event.getEventId().version()).isEqualTo(7);
        assertThat(event.getMetadata()).isEmpty();
        assertThat(event.getUserId()).isNull();
        assertThat(event.getDurationMs()).isNull();
    }

    @Test
    void createdAtDefaultsToNow() {
        Instant before = Instant.now();
        MetricEvent event = MetricEvent.builder(EventType.ERROR, EventNames.error("timeout")).build();

        assertThat(event.getCreatedAt()).isBetween(before, Instant.now());
        assertThat(event.getHourBucket()).isEqualTo(MetricBuckets.hourBucket(event.getCreatedAt()));
    }

    @Test
    void metadataIsCopiedAndImmutable() {
        MetricEvent event = MetricEvent.builder(EventType.REQUEST, EventNames.API_REQUEST)
                .putMetadata("status_group", "2xx")
                .createdAt(Instant.now())
                .build();

        assertThat(event.getMetadata()).containsEntry("status_group", "2xx");
        assertThatThrownBy(() -> event.getMetadata().put("x", "y")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void timeOrderedIdsSortByCreation() {
        TimeOrderedIds ids = new TimeOrderedIds(Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC));
        List<UUID> generated = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            generated.add(ids.nextId());
        }

        List<UUID> sorted = new ArrayList<>(generated);
        sorted.sort((a, b) -> Long.compareUnsigned(a.getMostSignificantBits(), b.getMostSignificantBits()));
        assertThat(sorted).containsExactlyElementsOf(generated);
        assertThat(generated).doesNotHaveDuplicates();
        assertThat(generated.get(0).variant()).isEqualTo(2);
    }

    @Test
    void eventTypeRoundTripsThroughStoredValue() {
        for (EventType type : EventType.values()) {
            assertThat(EventType.fromValue(type.value())).isSameAs(type);
        }
        assertThat(EventNames.error("Validation")).isEqualTo("error_validation");
        assertThat(EventNames.statusGroup(404)).isEqualTo("4xx");
        assertThatThrownBy(() -> EventType.fromValue("metric")).isInstanceOf(IllegalArgumentException.class);
    }
}
