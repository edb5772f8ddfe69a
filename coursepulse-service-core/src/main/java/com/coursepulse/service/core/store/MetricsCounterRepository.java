package com.coursepulse.service.core.store;

/** Durable monotonically increasing counters. Increments must be atomic in the store. */
public interface MetricsCounterRepository {

    void increment(String counterKey, long delta);

    /** Current value, {@code 0} when the counter was never incremented. */
    long get(String counterKey);
}
