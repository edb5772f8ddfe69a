package com.coursepulse.service.core.emitter;

import static com.coursepulse.service.core.support.Waits.waitUntil;
import static org.assertj.core.api.Assertions.assertThat;

import com.coursepulse.service.core.collector.MetricsCollector;
import com.coursepulse.service.core.config.MetricsProperties;
import com.coursepulse.service.core.model.DimensionKeyService;
import com.coursepulse.service.core.model.DimensionKeys;
import com.coursepulse.service.core.model.EventNames;
import com.coursepulse.service.core.model.HourlyAggregate;
import com.coursepulse.service.core.model.MetricEvent;
import com.coursepulse.service.core.support.InMemoryCounterCache;
import com.coursepulse.service.core.support.InMemoryMetricsStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.Test;

/** Emitter, collector and cache working together on in-memory stores. */
class MetricsPipelineScenarioTest {

    @Test
    void hundredFiftyRequestsAreFlushedInTwoBatches() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-15T10:30:00Z"), ZoneOffset.UTC);
        InMemoryMetricsStore store = new InMemoryMetricsStore();
        InMemoryCounterCache cache = new InMemoryCounterCache();
        List<Integer> batchSizes = new CopyOnWriteArrayList<>();
        MetricsCollector collector = new MetricsCollector(store, store, store, new DimensionKeyService(100)) {
            @Override
            public void processBatch(List<MetricEvent> events) {
                batchSizes.add(events.size());
                super.processBatch(events);
            }
        };
        MetricsProperties.Emitter config = new MetricsProperties.Emitter();
        config.setBatchSize(100);
        config.setFlushInterval(Duration.ofSeconds(1));
        MetricsEmitter emitter = new MetricsEmitter(collector, cache, config, clock);

        double expectedSum = 0.0;
        emitter.start();
        try {
            for (int i = 0; i < 150; i++) {
                double duration = 10.0 + (i % 11);
                expectedSum += duration;
                assertThat(emitter.emitRequest("GET", "/courses", 200, duration, "req-" + i, null))
                        .isTrue();
            }
            assertThat(waitUntil(() -> emitter.getStats().eventsProcessed() == 150, Duration.ofSeconds(5)))
                    .isTrue();
        } finally {
            emitter.stop();
        }

        assertThat(emitter.getStats().batchesFlushed()).isEqualTo(2);
        assertThat(batchSizes).containsExactly(100, 50);
        assertThat(emitter.getStats().eventsDropped()).isZero();

        HourlyAggregate apiRequest = store.hourlyRow("2024-01-15", 10, EventNames.API_REQUEST, DimensionKeys.DEFAULT);
        assertThat(apiRequest.count()).isEqualTo(150);
        assertThat(apiRequest.stats().minValue()).isEqualTo(10.0);
        assertThat(apiRequest.stats().maxValue()).isEqualTo(20.0);
        assertThat(apiRequest.stats().sumValue()).isEqualTo(expectedSum).isEqualTo(2236.0);

        HourlyAggregate success =
                store.hourlyRow("2024-01-15", 10, EventNames.REQUEST_BY_STATUS, DimensionKeys.of(Map.of("status", "2xx")));
        assertThat(success.count()).isEqualTo(150);

        assertThat(store.counters).containsEntry("2024-01-15-10:request:total", 150L);
        assertThat(cache.read("2024-01-15-10")).containsEntry("api_request", 150L);
    }
}
