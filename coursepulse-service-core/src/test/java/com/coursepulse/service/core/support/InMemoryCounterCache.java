package com.coursepulse.service.core.support;

import com.coursepulse.service.core.cache.RealtimeCounterCache;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryCounterCache implements RealtimeCounterCache {

    public final Map<String, Map<String, Long>> byHour = new ConcurrentHashMap<>();
    public volatile boolean fail;

    @Override
    public void increment(String hourBucket, Map<String, Long> deltasBySuffix) {
        check();
        Map<String, Long> counters = byHour.computeIfAbsent(hourBucket, h -> new ConcurrentHashMap<>());
        deltasBySuffix.forEach((suffix, delta) -> counters.merge(suffix, delta, Long::sum));
    }

    @Override
    public Map<String, Long> read(String hourBucket) {
        check();
        return new LinkedHashMap<>(byHour.getOrDefault(hourBucket, Map.of()));
    }

    @Override
    public void ping() {
        check();
    }

    private void check() {
        if (fail) {
            throw new IllegalStateException("cache unavailable");
        }
    }
}
