package com.coursepulse.service.core.emitter;

import java.time.Instant;

/** Point-in-time view of emitter counters. {@code lastFlushAt} is {@code null} before the first flush. */
public record EmitterStats(
        boolean running,
        int queueCapacity,
        int queueLength,
        double queueUtilization,
        long eventsEmitted,
        long eventsProcessed,
        long eventsDropped,
        long batchesFlushed,
        Instant lastFlushAt,
        double uptimeSeconds) {}
