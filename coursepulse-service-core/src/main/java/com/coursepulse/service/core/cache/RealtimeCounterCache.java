package com.coursepulse.service.core.cache;

import java.util.Map;

/**
 * Short-lived per-hour counters backing the realtime view.
 *
 * <p>Counters are addressed by hour bucket and suffix ({@code request}, {@code api_request},
 * {@code status:2xx}, {@code method:GET}); implementations choose the physical key layout and
 * expire entries on their own.
 */
public interface RealtimeCounterCache {

    void increment(String hourBucket, Map<String, Long> deltasBySuffix);

    /** Suffix to value for every counter of the given hour. */
    Map<String, Long> read(String hourBucket);

    /** Round trip against the cache; any exception means unreachable. */
    void ping();
}
