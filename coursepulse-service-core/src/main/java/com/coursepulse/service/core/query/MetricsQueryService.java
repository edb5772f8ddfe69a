package com.coursepulse.service.core.query;

import com.coursepulse.service.core.cache.RealtimeCounterCache;
import com.coursepulse.service.core.emitter.EmitterStats;
import com.coursepulse.service.core.emitter.MetricsEmitter;
import com.coursepulse.service.core.model.AggregateStats;
import com.coursepulse.service.core.model.DailyAggregate;
import com.coursepulse.service.core.model.EventNames;
import com.coursepulse.service.core.model.EventType;
import com.coursepulse.service.core.model.HourlyAggregate;
import com.coursepulse.service.core.model.MetricBuckets;
import com.coursepulse.service.core.store.DailyAggregateRepository;
import com.coursepulse.service.core.store.HourlyAggregateRepository;
import com.coursepulse.service.core.store.MetricsCounterRepository;
import com.coursepulse.service.core.store.StoreHealthProbe;
import com.coursepulse.service.core.system.SystemResourceProbe;
import com.coursepulse.service.core.system.SystemResources;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Read side of the metrics pipeline. Reports are computed from pre-aggregated hourly and daily
 * rows; every slice of a report degrades to zero or empty values when its read fails.
 */
@Slf4j
public class MetricsQueryService {

    private static final int TOP_ENDPOINTS = 10;

    private final HourlyAggregateRepository hourlyRepository;
    private final DailyAggregateRepository dailyRepository;
    private final MetricsCounterRepository counterRepository;
    private final StoreHealthProbe storeProbe;
    private final RealtimeCounterCache counterCache;
    private final MetricsEmitter emitter;
    private final SystemResourceProbe systemProbe;
    private final Clock clock;

    /**
     * @param counterCache optional, {@code null} when no realtime cache is configured
     * @param emitter      optional, {@code null} on hosts that only read metrics
     */
    public MetricsQueryService(
            HourlyAggregateRepository hourlyRepository,
            DailyAggregateRepository dailyRepository,
            MetricsCounterRepository counterRepository,
            StoreHealthProbe storeProbe,
            RealtimeCounterCache counterCache,
            MetricsEmitter emitter,
            SystemResourceProbe systemProbe,
            Clock clock) {
        this.hourlyRepository = hourlyRepository;
        this.dailyRepository = dailyRepository;
        this.counterRepository = counterRepository;
        this.storeProbe = storeProbe;
        this.counterCache = counterCache;
        this.emitter = emitter;
        this.systemProbe = systemProbe;
        this.clock = clock;
    }

    // ---------- Dashboard

    public DashboardMetrics getDashboardMetrics(Period period, Instant start, Instant end) {
        Instant now = clock.instant();
        Period p = period == null ? Period.TODAY : period;
        TimeRange range = p.resolve(now, start, end);

        String day = MetricBuckets.dayBucket(range.start());
        String previousDay = MetricBuckets.dayBucket(range.start().minus(Duration.ofDays(1)));
        RequestStats requests = requestStats(day);
        BusinessStats business = businessStats(day);
        RequestStats prevRequests = requestStats(previousDay);
        BusinessStats prevBusiness = businessStats(previousDay);

        return new DashboardMetrics(
                p,
                range.start(),
                range.end(),
                requests.total,
                requests.success,
                requests.error,
                requests.avgDuration(),
                requests.stats.maxValue(),
                business.activeUsers,
                business.newUsers,
                business.enrollments,
                business.completions,
                business.comments,
                calcTrend(requests.total, prevRequests.total),
                calcTrend(business.activeUsers, prevBusiness.activeUsers),
                calcTrend(business.enrollments, prevBusiness.enrollments),
                now);
    }

    /** Percentage change; {@code 100} when growing from zero, {@code 0} when both are zero. */
    public static double calcTrend(double current, double previous) {
        if (previous == 0) {
            return current > 0 ? 100.0 : 0.0;
        }
        return (current - previous) / previous * 100.0;
    }

    // ---------- Breakdowns

    public RequestMetrics getRequestMetrics(Instant start, Instant end) {
        String day = MetricBuckets.dayBucket(start);
        RequestStats stats = requestStats(day);

        Map<String, Long> byStatus = new TreeMap<>();
        Map<String, Long> byMethod = new TreeMap<>();
        Map<String, EndpointAccumulator> endpoints = new LinkedHashMap<>();
        for (HourlyAggregate row : hourlyRows(day, "request breakdown")) {
            switch (row.metricName()) {
                case EventNames.REQUEST_BY_STATUS -> byStatus.merge(
                        row.dimensions().getOrDefault("status", "unknown"), row.count(), Long::sum);
                case EventNames.REQUEST_BY_METHOD -> byMethod.merge(
                        row.dimensions().getOrDefault("method", "UNKNOWN"), row.count(), Long::sum);
                case EventNames.REQUEST_BY_PATH -> endpoints
                        .computeIfAbsent(row.dimensions().getOrDefault("path", "unknown"), k -> new EndpointAccumulator())
                        .add(row.stats());
                default -> {
                    // other metrics are not part of the request breakdown
                }
            }
        }

        List<EndpointStats> all = new ArrayList<>();
        endpoints.forEach((path, acc) -> all.add(new EndpointStats(path, acc.count, acc.sum / Math.max(acc.count, 1L))));
        List<EndpointStats> slowest = all.stream()
                .sorted(Comparator.comparingDouble(EndpointStats::avgMs).reversed())
                .limit(TOP_ENDPOINTS)
                .toList();
        List<EndpointStats> busiest = all.stream()
                .sorted(Comparator.comparingLong(EndpointStats::count).reversed())
                .limit(TOP_ENDPOINTS)
                .toList();

        return new RequestMetrics(
                stats.total,
                stats.success,
                stats.error,
                byStatus,
                byMethod,
                stats.avgDuration(),
                stats.stats.minValue(),
                stats.stats.maxValue(),
                null,
                null,
                null,
                slowest,
                busiest);
    }

    public BusinessMetrics getBusinessMetrics(Instant start, Instant end) {
        String day = MetricBuckets.dayBucket(start);
        BusinessStats stats = businessStats(day);
        Map<String, Long> counts = countsByMetric(day);
        return new BusinessMetrics(
                stats.enrollments,
                stats.completions,
                counts.getOrDefault(EventNames.COURSE_COMPLETED, 0L),
                stats.comments,
                counts.getOrDefault(EventNames.REACTION_ADDED, 0L),
                stats.newUsers,
                stats.activeUsers);
    }

    public UserMetrics getUserMetrics(Instant start, Instant end) {
        String day = MetricBuckets.dayBucket(start);
        long logins = 0;
        long registrations = 0;
        Map<String, Long> byHour = new TreeMap<>(Comparator.comparingInt(Integer::parseInt));
        for (HourlyAggregate row : hourlyRows(day, "user metrics")) {
            if (EventNames.USER_LOGIN.equals(row.metricName())) {
                logins += row.count();
                byHour.merge(String.valueOf(row.hour()), row.count(), Long::sum);
            } else if (EventNames.USER_REGISTERED.equals(row.metricName())) {
                registrations += row.count();
            }
        }
        return new UserMetrics(null, registrations, logins, null, byHour);
    }

    public CourseMetrics getCourseMetrics(Instant start, Instant end) {
        Map<String, Long> counts = countsByMetric(MetricBuckets.dayBucket(start));
        long views = counts.getOrDefault(EventNames.LESSON_STARTED, 0L);
        long completions = counts.getOrDefault(EventNames.LESSON_COMPLETED, 0L);
        double rate = round2(completions * 100.0 / Math.max(views, 1L));
        return new CourseMetrics(
                views, counts.getOrDefault(EventNames.ENROLLMENT_CREATED, 0L), completions, rate, List.of(), List.of());
    }

    // ---------- Time series

    public TimeSeriesResponse getTimeseries(String metricName, Instant start, Instant end, Granularity granularity) {
        Granularity g = granularity == null ? Granularity.HOURLY : granularity;
        List<TimeSeriesPoint> points = new ArrayList<>();
        long totalCount = 0;
        double totalValue = 0.0;
        try {
            if (g == Granularity.HOURLY) {
                String day = MetricBuckets.dayBucket(start);
                for (HourlyAggregate row : hourlyRepository.findByDayAndMetric(day, metricName)) {
                    points.add(new TimeSeriesPoint(
                            MetricBuckets.hourStart(day, row.hour()),
                            row.stats().average(),
                            metricName,
                            row.dimensions()));
                    totalCount += row.count();
                    totalValue += row.stats().sumValue();
                }
            } else {
                String month = MetricBuckets.monthBucket(start);
                for (DailyAggregate row : dailyRepository.findByMonth(month)) {
                    if (!row.metricName().equals(metricName)) {
                        continue;
                    }
                    points.add(new TimeSeriesPoint(
                            MetricBuckets.dayStart(month, row.day()),
                            row.stats().average(),
                            metricName,
                            row.dimensions()));
                    totalCount += row.count();
                    totalValue += row.stats().sumValue();
                }
            }
        } catch (Exception ex) {
            log.error("Failed to read time series metric={} granularity={}", metricName, g, ex);
        }
        points.sort(Comparator.comparing(TimeSeriesPoint::timestamp));
        return new TimeSeriesResponse(
                metricName, g, start, end, points, totalCount, round2(totalValue / Math.max(totalCount, 1L)));
    }

    // ---------- Realtime and status

    public RealtimeCounters getRealtimeCounters() {
        Instant now = clock.instant();
        String hourBucket = MetricBuckets.hourBucket(now);
        Map<String, Long> counters = new TreeMap<>();
        if (counterCache != null) {
            try {
                counters.putAll(counterCache.read(hourBucket));
            } catch (Exception ex) {
                log.error("Failed to read realtime counters hourBucket={}", hourBucket, ex);
            }
        }
        return new RealtimeCounters(counters, now, hourBucket);
    }

    public MetricsSummary getSummary() {
        Instant now = clock.instant();
        String hourBucket = MetricBuckets.hourBucket(now);
        long requests = counter(hourBucket + ":" + EventType.REQUEST.value() + ":total");
        long errors = counter(hourBucket + ":" + EventType.ERROR.value() + ":total");

        String day = MetricBuckets.dayBucket(now);
        int hour = MetricBuckets.hourOfDay(now);
        AggregateStats hourRequests = AggregateStats.EMPTY;
        long logins = 0;
        for (HourlyAggregate row : hourlyRows(day, "summary")) {
            if (EventNames.API_REQUEST.equals(row.metricName()) && row.hour() == hour) {
                hourRequests = hourRequests.merge(row.stats());
            } else if (EventNames.USER_LOGIN.equals(row.metricName())) {
                logins += row.count();
            }
        }

        int queueSize = emitter != null ? emitter.queueLength() : 0;
        int capacity = emitter != null ? emitter.queueCapacity() : 0;
        String status = emitter == null ? "absent" : emitter.isRunning() ? "running" : "stopped";
        return new MetricsSummary(
                requests, errors, round2(hourRequests.average()), logins, queueSize, capacity, status);
    }

    public MetricsHealth getHealth() {
        EmitterStats stats = emitter != null ? emitter.getStats() : null;

        boolean storeConnected = false;
        try {
            storeProbe.ping();
            storeConnected = true;
        } catch (Exception ex) {
            log.debug("Metrics store health check failed", ex);
        }

        boolean cacheConnected = false;
        if (counterCache != null) {
            try {
                counterCache.ping();
                cacheConnected = true;
            } catch (Exception ex) {
                log.debug("Metrics cache health check failed", ex);
            }
        }

        SystemResources resources = null;
        try {
            resources = systemProbe.snapshot();
        } catch (Exception ex) {
            log.error("Failed to collect system resources", ex);
        }

        boolean emitterRunning = stats != null && stats.running();
        return new MetricsHealth(
                emitterRunning && storeConnected,
                emitterRunning,
                stats != null ? stats.queueLength() : 0,
                stats != null ? stats.queueCapacity() : 0,
                stats != null ? stats.queueUtilization() : 0.0,
                storeConnected,
                cacheConnected,
                stats != null ? stats.eventsProcessed() : 0L,
                stats != null ? stats.eventsDropped() : 0L,
                stats != null ? stats.lastFlushAt() : null,
                stats != null ? stats.uptimeSeconds() : 0.0,
                resources);
    }

    // ---------- Helpers

    private RequestStats requestStats(String day) {
        RequestStats stats = new RequestStats();
        for (HourlyAggregate row : hourlyRows(day, "request stats")) {
            if (EventNames.API_REQUEST.equals(row.metricName())) {
                stats.total += row.count();
                stats.stats = stats.stats.merge(row.stats());
            } else if (EventNames.REQUEST_BY_STATUS.equals(row.metricName())) {
                String status = row.dimensions().getOrDefault("status", "");
                if ("2xx".equals(status)) {
                    stats.success += row.count();
                } else if ("4xx".equals(status) || "5xx".equals(status)) {
                    stats.error += row.count();
                }
            }
        }
        return stats;
    }

    private BusinessStats businessStats(String day) {
        Map<String, Long> counts = countsByMetric(day);
        BusinessStats stats = new BusinessStats();
        stats.activeUsers = counts.getOrDefault(EventNames.USER_LOGIN, 0L);
        stats.newUsers = counts.getOrDefault(EventNames.USER_REGISTERED, 0L);
        stats.enrollments = counts.getOrDefault(EventNames.ENROLLMENT_CREATED, 0L);
        stats.completions = counts.getOrDefault(EventNames.LESSON_COMPLETED, 0L);
        stats.comments = counts.getOrDefault(EventNames.COMMENT_CREATED, 0L);
        return stats;
    }

    private Map<String, Long> countsByMetric(String day) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (HourlyAggregate row : hourlyRows(day, "metric counts")) {
            counts.merge(row.metricName(), row.count(), Long::sum);
        }
        return counts;
    }

    private List<HourlyAggregate> hourlyRows(String day, String purpose) {
        try {
            return hourlyRepository.findByDay(day);
        } catch (Exception ex) {
            log.error("Failed to read hourly aggregates for {} day={}", purpose, day, ex);
            return List.of();
        }
    }

    private long counter(String key) {
        try {
            return counterRepository.get(key);
        } catch (Exception ex) {
            log.error("Failed to read counter key={}", key, ex);
            return 0L;
        }
    }

    static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }

    private static final class RequestStats {
        private long total;
        private long success;
        private long error;
        private AggregateStats stats = AggregateStats.EMPTY;

        double avgDuration() {
            return total > 0 ? stats.sumValue() / total : 0.0;
        }
    }

    private static final class BusinessStats {
        private long activeUsers;
        private long newUsers;
        private long enrollments;
        private long completions;
        private long comments;
    }

    private static final class EndpointAccumulator {
        private long count;
        private double sum;

        void add(AggregateStats stats) {
            count += stats.count();
            sum += stats.sumValue();
        }
    }
}
