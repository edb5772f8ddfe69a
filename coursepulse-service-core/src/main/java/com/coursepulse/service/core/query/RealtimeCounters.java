package com.coursepulse.service.core.query;

import java.time.Instant;
import java.util.Map;

public record RealtimeCounters(Map<String, Long> counters, Instant timestamp, String bucket) {}
