package com.coursepulse.service.core.store;

import com.coursepulse.service.core.model.EventType;
import com.coursepulse.service.core.model.MetricEvent;
import java.util.List;

/** Raw event storage partitioned by hour bucket. */
public interface MetricsEventRepository {

    void insert(MetricEvent event);

    /**
     * Newest first.
     *
     * @param eventType optional filter, {@code null} for all types
     */
    List<MetricEvent> findByHourBucket(String hourBucket, EventType eventType, int limit);
}
