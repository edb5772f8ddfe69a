package com.coursepulse.service.core.collector;

import com.coursepulse.service.core.model.AggregateStats;
import com.coursepulse.service.core.model.DimensionKeyService;
import com.coursepulse.service.core.model.EventNames;
import com.coursepulse.service.core.model.EventType;
import com.coursepulse.service.core.model.HourlyAggregate;
import com.coursepulse.service.core.model.MetricBuckets;
import com.coursepulse.service.core.model.MetricEvent;
import com.coursepulse.service.core.store.HourlyAggregateRepository;
import com.coursepulse.service.core.store.MetricsCounterRepository;
import com.coursepulse.service.core.store.MetricsEventRepository;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Persists event batches: raw rows, hourly aggregates and durable counters.
 *
 * <p>Hourly rows are updated with read-merge-write, so callers must serialize
 * {@link #processBatch(List)}; the emitter's single worker does.
 */
@Slf4j
@RequiredArgsConstructor
public class MetricsCollector {

    public static final int DEFAULT_RAW_EVENT_LIMIT = 100;

    private final MetricsEventRepository eventRepository;
    private final HourlyAggregateRepository hourlyRepository;
    private final MetricsCounterRepository counterRepository;
    private final DimensionKeyService dimensionKeys;

    public void processBatch(List<MetricEvent> events) {
        if (events == null || events.isEmpty()) {
            return;
        }
        int stored = storeRawEvents(events);
        int groups = updateHourlyAggregates(events);
        int counters = incrementCounters(events);
        log.debug(
                "Processed metrics batch size={} stored={} hourlyGroups={} counters={}",
                events.size(),
                stored,
                groups,
                counters);
    }

    private int storeRawEvents(List<MetricEvent> events) {
        int stored = 0;
        for (MetricEvent event : events) {
            try {
                eventRepository.insert(event);
                stored++;
            } catch (Exception ex) {
                log.error("Failed to store raw metric event id={} name={}", event.getEventId(), event.getEventName(), ex);
            }
        }
        return stored;
    }

    private int updateHourlyAggregates(List<MetricEvent> events) {
        Map<GroupKey, Group> groups = new LinkedHashMap<>();
        for (MetricEvent event : events) {
            String dayBucket = MetricBuckets.dayBucket(event.getCreatedAt());
            int hour = MetricBuckets.hourOfDay(event.getCreatedAt());
            contribute(groups, dayBucket, hour, event.getEventName(), Map.of(), event.getDurationMs());
            if (event.getEventType() == EventType.REQUEST) {
                if (event.getStatusCode() != null) {
                    contribute(
                            groups,
                            dayBucket,
                            hour,
                            EventNames.REQUEST_BY_STATUS,
                            Map.of("status", EventNames.statusGroup(event.getStatusCode())),
                            event.getDurationMs());
                }
                if (event.getMethod() != null) {
                    contribute(
                            groups,
                            dayBucket,
                            hour,
                            EventNames.REQUEST_BY_METHOD,
                            Map.of("method", event.getMethod()),
                            event.getDurationMs());
                }
                if (event.getPath() != null) {
                    contribute(
                            groups,
                            dayBucket,
                            hour,
                            EventNames.REQUEST_BY_PATH,
                            Map.of("path", event.getPath()),
                            event.getDurationMs());
                }
            }
        }

        int written = 0;
        for (Map.Entry<GroupKey, Group> entry : groups.entrySet()) {
            GroupKey key = entry.getKey();
            Group group = entry.getValue();
            try {
                AggregateStats merged = hourlyRepository
                        .find(key.dayBucket(), key.hour(), key.metricName(), key.dimensionKey())
                        .map(existing -> existing.stats().merge(group.stats))
                        .orElse(group.stats);
                hourlyRepository.upsert(new HourlyAggregate(
                        key.dayBucket(), key.hour(), key.metricName(), key.dimensionKey(), group.dimensions, merged));
                written++;
            } catch (Exception ex) {
                log.error(
                        "Failed to update hourly aggregate day={} hour={} metric={} dimensionKey={}",
                        key.dayBucket(),
                        key.hour(),
                        key.metricName(),
                        key.dimensionKey(),
                        ex);
            }
        }
        return written;
    }

    private void contribute(
            Map<GroupKey, Group> groups,
            String dayBucket,
            int hour,
            String metricName,
            Map<String, String> dimensions,
            Double value) {
        GroupKey key = new GroupKey(dayBucket, hour, metricName, dimensionKeys.keyFor(dimensions));
        groups.computeIfAbsent(key, k -> new Group(dimensions)).add(value);
    }

    private int incrementCounters(List<MetricEvent> events) {
        Map<String, Long> deltas = new LinkedHashMap<>();
        for (MetricEvent event : events) {
            for (String key : counterKeys(event)) {
                deltas.merge(key, 1L, Long::sum);
            }
        }
        int applied = 0;
        for (Map.Entry<String, Long> entry : deltas.entrySet()) {
            try {
                counterRepository.increment(entry.getKey(), entry.getValue());
                applied++;
            } catch (Exception ex) {
                log.error("Failed to increment counter key={} delta={}", entry.getKey(), entry.getValue(), ex);
            }
        }
        return applied;
    }

    /** Durable counter keys touched by one event, all scoped to the event's hour bucket. */
    static List<String> counterKeys(MetricEvent event) {
        String hb = event.getHourBucket();
        List<String> keys = new ArrayList<>(4);
        keys.add(hb + ":" + event.getEventType().value() + ":total");
        keys.add(hb + ":" + event.getEventName());
        if (event.getEventType() == EventType.REQUEST) {
            if (event.getStatusCode() != null) {
                keys.add(hb + ":status:" + EventNames.statusGroup(event.getStatusCode()));
            }
            if (event.getMethod() != null) {
                keys.add(hb + ":method:" + event.getMethod());
            }
        }
        return keys;
    }

    // ---------- Diagnostics

    /** Hourly rows of a day, optionally restricted to one metric. Empty on read failure. */
    public List<HourlyAggregate> getHourlyMetrics(String dayBucket, String metricName) {
        try {
            return metricName == null
                    ? hourlyRepository.findByDay(dayBucket)
                    : hourlyRepository.findByDayAndMetric(dayBucket, metricName);
        } catch (Exception ex) {
            log.error("Failed to read hourly metrics day={} metric={}", dayBucket, metricName, ex);
            return List.of();
        }
    }

    /** Raw events of an hour, newest first. Empty on read failure. */
    public List<MetricEvent> getRawEvents(String hourBucket, EventType eventType, int limit) {
        try {
            return eventRepository.findByHourBucket(hourBucket, eventType, limit > 0 ? limit : DEFAULT_RAW_EVENT_LIMIT);
        } catch (Exception ex) {
            log.error("Failed to read raw events hourBucket={} type={}", hourBucket, eventType, ex);
            return List.of();
        }
    }

    private record GroupKey(String dayBucket, int hour, String metricName, String dimensionKey) {}

    private static final class Group {
        private final Map<String, String> dimensions;
        private AggregateStats stats = AggregateStats.EMPTY;

        Group(Map<String, String> dimensions) {
            this.dimensions = dimensions;
        }

        void add(Double value) {
            stats = stats.add(value);
        }
    }
}
