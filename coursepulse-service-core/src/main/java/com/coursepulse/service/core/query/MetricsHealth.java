package com.coursepulse.service.core.query;

import com.coursepulse.service.core.system.SystemResources;
import java.time.Instant;

/** {@code healthy} requires a running emitter and a reachable store; the cache is optional. */
public record MetricsHealth(
        boolean healthy,
        boolean emitterRunning,
        int queueSize,
        int queueCapacity,
        double queueUtilization,
        boolean storeConnected,
        boolean cacheConnected,
        long eventsProcessedTotal,
        long eventsDroppedTotal,
        Instant lastFlushAt,
        double uptimeSeconds,
        SystemResources systemResources) {}
