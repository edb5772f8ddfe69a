package com.coursepulse.service.core.store;

import com.coursepulse.service.core.model.HourlyAggregate;
import java.util.List;
import java.util.Optional;

public interface HourlyAggregateRepository {

    Optional<HourlyAggregate> find(String dayBucket, int hour, String metricName, String dimensionKey);

    /** Writes the row as given, replacing any existing row with the same key. */
    void upsert(HourlyAggregate aggregate);

    List<HourlyAggregate> findByDay(String dayBucket);

    List<HourlyAggregate> findByDayAndMetric(String dayBucket, String metricName);
}
