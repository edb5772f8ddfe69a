package com.coursepulse.service.core.store;

import com.coursepulse.service.core.model.DailyAggregate;
import java.util.List;

public interface DailyAggregateRepository {

    /** Writes the row as given, replacing any existing row with the same key. */
    void upsert(DailyAggregate aggregate);

    List<DailyAggregate> findByMonth(String monthBucket);
}
