package com.coursepulse.service.core.emitter;

import com.coursepulse.service.core.cache.RealtimeCounterCache;
import com.coursepulse.service.core.collector.MetricsCollector;
import com.coursepulse.service.core.config.MetricsProperties;
import com.coursepulse.service.core.model.EventNames;
import com.coursepulse.service.core.model.EventType;
import com.coursepulse.service.core.model.MetricEvent;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Non-blocking metrics emitter backed by a bounded queue and a single batching worker.
 *
 * <p>{@link #emit(MetricEvent)} never blocks: when the queue is full the event is dropped and
 * counted. The worker hands batches to the {@link MetricsCollector} once {@code batchSize} events
 * are buffered or the oldest buffered event has waited {@code flushInterval}. Only one worker
 * exists per emitter, which makes it the single writer of hourly aggregates in this process.
 */
@Slf4j
public class MetricsEmitter {

    static final String WORKER_NAME = "coursepulse-metrics-worker";
    private static final int MAX_ERROR_MESSAGE = 200;

    private final MetricsCollector collector;
    private final RealtimeCounterCache counterCache;
    private final Clock clock;

    private final int queueCapacity;
    private final int batchSize;
    private final Duration flushInterval;
    private final Duration stopTimeout;
    private final BlockingQueue<MetricEvent> queue;

    private final Object lifecycleLock = new Object();
    private final ReentrantLock flushLock = new ReentrantLock();
    private final AtomicBoolean running = new AtomicBoolean();
    private volatile Thread worker;

    private final AtomicLong eventsEmitted = new AtomicLong();
    private final AtomicLong eventsProcessed = new AtomicLong();
    private final AtomicLong eventsDropped = new AtomicLong();
    private final AtomicLong batchesFlushed = new AtomicLong();
    private volatile Instant lastFlushAt;
    private volatile Instant startedAt;

    /**
     * @param counterCache optional realtime cache, {@code null} when none is configured
     */
    public MetricsEmitter(
            MetricsCollector collector,
            RealtimeCounterCache counterCache,
            MetricsProperties.Emitter config,
            Clock clock) {
        this.collector = collector;
        this.counterCache = counterCache;
        this.clock = clock;
        this.queueCapacity = requirePositive(config.getQueueCapacity(), "queueCapacity");
        this.batchSize = requirePositive(config.getBatchSize(), "batchSize");
        this.flushInterval = requirePositive(config.getFlushInterval(), "flushInterval");
        this.stopTimeout = requirePositive(config.getStopTimeout(), "stopTimeout");
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
    }

    // ---------- Producer side

    /** Enqueues without blocking. Returns {@code false} when the event was dropped. */
    public boolean emit(MetricEvent event) {
        if (event == null) {
            return false;
        }
        if (queue.offer(event)) {
            eventsEmitted.incrementAndGet();
            return true;
        }
        long dropped = eventsDropped.incrementAndGet();
        log.warn(
                "Metrics queue full, dropping event name={} capacity={} droppedTotal={}",
                event.getEventName(),
                queueCapacity,
                dropped);
        return false;
    }

    public boolean emitRequest(
            String method, String path, int statusCode, double durationMs, String requestId, UUID userId) {
        return emit(MetricEvent.builder(EventType.REQUEST, EventNames.API_REQUEST)
                .method(method)
                .path(path)
                .statusCode(statusCode)
                .durationMs(durationMs)
                .requestId(requestId)
                .userId(userId)
                .putMetadata("status_group", EventNames.statusGroup(statusCode))
                .createdAt(clock.instant())
                .build());
    }

    public boolean emitBusiness(
            String eventName, UUID userId, UUID courseId, UUID lessonId, Map<String, String> metadata) {
        return emit(MetricEvent.builder(EventType.BUSINESS, eventName)
                .userId(userId)
                .courseId(courseId)
                .lessonId(lessonId)
                .metadata(metadata)
                .createdAt(clock.instant())
                .build());
    }

    public boolean emitError(String errorType, String errorMessage, String path, UUID userId, String requestId) {
        String type = errorType == null ? "unknown" : errorType;
        String message = errorMessage == null ? "" : errorMessage;
        if (message.length() > MAX_ERROR_MESSAGE) {
            message = message.substring(0, MAX_ERROR_MESSAGE);
        }
        return emit(MetricEvent.builder(EventType.ERROR, EventNames.error(type))
                .path(path)
                .userId(userId)
                .requestId(requestId)
                .putMetadata("error_type", type)
                .putMetadata("error_message", message)
                .createdAt(clock.instant())
                .build());
    }

    // ---------- Lifecycle

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                log.warn("Metrics emitter already running");
                return;
            }
            running.set(true);
            startedAt = clock.instant();
            Thread t = new Thread(this::runLoop, WORKER_NAME);
            t.setDaemon(true);
            worker = t;
            t.start();
            log.info(
                    "Metrics emitter started queueCapacity={} batchSize={} flushInterval={}",
                    queueCapacity,
                    batchSize,
                    flushInterval);
        }
    }

    /**
     * Stops the worker, waiting up to {@code stopTimeout} before interrupting it, then flushes
     * whatever is still queued on the calling thread. The whole call is bounded by twice
     * {@code stopTimeout}: when a flush is stuck past that, the queued events are abandoned. Safe
     * to call when not running.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.getAndSet(false)) {
                return;
            }
            long deadline = System.nanoTime() + 2 * stopTimeout.toNanos();
            Thread t = worker;
            worker = null;
            try {
                if (t != null) {
                    t.join(stopTimeout.toMillis());
                    if (t.isAlive()) {
                        log.warn("Metrics worker did not stop within {}, interrupting", stopTimeout);
                        t.interrupt();
                        TimeUnit.NANOSECONDS.timedJoin(t, remaining(deadline));
                    }
                }
                if (flushLock.tryLock(remaining(deadline), TimeUnit.NANOSECONDS)) {
                    try {
                        flushRemaining();
                    } finally {
                        flushLock.unlock();
                    }
                } else {
                    log.warn(
                            "Metrics flush still in progress after {}, abandoning queued={}",
                            stopTimeout,
                            queue.size());
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                if (t != null) {
                    t.interrupt();
                }
                log.warn("Interrupted while stopping metrics emitter, abandoning queued={}", queue.size());
            }
            log.info(
                    "Metrics emitter stopped emitted={} processed={} dropped={} batches={}",
                    eventsEmitted.get(),
                    eventsProcessed.get(),
                    eventsDropped.get(),
                    batchesFlushed.get());
        }
    }

    private static long remaining(long deadline) {
        return Math.max(0L, deadline - System.nanoTime());
    }

    public boolean isRunning() {
        return running.get();
    }

    // ---------- Worker

    void runLoop() {
        List<MetricEvent> batch = new ArrayList<>(batchSize);
        long deadline = 0L;
        try {
            while (running.get()) {
                long waitNanos = batch.isEmpty() ? flushInterval.toNanos() : deadline - System.nanoTime();
                MetricEvent event = waitNanos > 0 ? queue.poll(waitNanos, TimeUnit.NANOSECONDS) : queue.poll();
                if (event != null) {
                    if (batch.isEmpty()) {
                        deadline = System.nanoTime() + flushInterval.toNanos();
                    }
                    batch.add(event);
                }
                boolean due = !batch.isEmpty() && System.nanoTime() - deadline >= 0;
                if (batch.size() >= batchSize || due) {
                    flush(batch);
                    batch = new ArrayList<>(batchSize);
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        } finally {
            if (!batch.isEmpty()) {
                // clear the flag so blocking store I/O in the final flush is not aborted
                boolean interrupted = Thread.interrupted();
                flush(batch);
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    private void flushRemaining() {
        List<MetricEvent> rest = new ArrayList<>();
        queue.drainTo(rest);
        for (int i = 0; i < rest.size(); i += batchSize) {
            flush(rest.subList(i, Math.min(rest.size(), i + batchSize)));
        }
    }

    void flush(List<MetricEvent> batch) {
        if (batch.isEmpty()) {
            return;
        }
        flushLock.lock();
        try {
            try {
                collector.processBatch(batch);
                eventsProcessed.addAndGet(batch.size());
                batchesFlushed.incrementAndGet();
                lastFlushAt = clock.instant();
                log.debug("Flushed metrics batch size={} queueDepth={}/{}", batch.size(), queue.size(), queueCapacity);
            } catch (Exception ex) {
                log.error("Failed to flush metrics batch size={}, discarding", batch.size(), ex);
                return;
            }
            updateRealtimeCounters(batch);
        } finally {
            flushLock.unlock();
        }
    }

    private void updateRealtimeCounters(List<MetricEvent> batch) {
        if (counterCache == null) {
            return;
        }
        Map<String, Map<String, Long>> byHour = new LinkedHashMap<>();
        for (MetricEvent event : batch) {
            Map<String, Long> deltas = byHour.computeIfAbsent(event.getHourBucket(), h -> new LinkedHashMap<>());
            deltas.merge(event.getEventType().value(), 1L, Long::sum);
            deltas.merge(event.getEventName(), 1L, Long::sum);
            if (event.getStatusCode() != null) {
                deltas.merge("status:" + EventNames.statusGroup(event.getStatusCode()), 1L, Long::sum);
            }
            if (event.getMethod() != null) {
                deltas.merge("method:" + event.getMethod(), 1L, Long::sum);
            }
        }
        byHour.forEach((hourBucket, deltas) -> {
            try {
                counterCache.increment(hourBucket, deltas);
            } catch (Exception ex) {
                log.warn("Failed to update realtime counters hourBucket={} keys={}", hourBucket, deltas.size(), ex);
            }
        });
    }

    // ---------- Stats

    public EmitterStats getStats() {
        int length = queue.size();
        Instant started = startedAt;
        double uptime = running.get() && started != null
                ? Duration.between(started, clock.instant()).toMillis() / 1000.0
                : 0.0;
        return new EmitterStats(
                running.get(),
                queueCapacity,
                length,
                length * 100.0 / queueCapacity,
                eventsEmitted.get(),
                eventsProcessed.get(),
                eventsDropped.get(),
                batchesFlushed.get(),
                lastFlushAt,
                uptime);
    }

    public int queueLength() {
        return queue.size();
    }

    public int queueCapacity() {
        return queueCapacity;
    }

    private static int requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be > 0: " + value);
        }
        return value;
    }

    private static Duration requirePositive(Duration value, String name) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
        return value;
    }
}
