package com.coursepulse.reference.api;

import com.coursepulse.service.core.query.BusinessMetrics;
import com.coursepulse.service.core.query.CourseMetrics;
import com.coursepulse.service.core.query.DashboardMetrics;
import com.coursepulse.service.core.query.Granularity;
import com.coursepulse.service.core.query.MetricsHealth;
import com.coursepulse.service.core.query.MetricsQueryService;
import com.coursepulse.service.core.query.MetricsSummary;
import com.coursepulse.service.core.query.Period;
import com.coursepulse.service.core.query.RealtimeCounters;
import com.coursepulse.service.core.query.RequestMetrics;
import com.coursepulse.service.core.query.TimeRange;
import com.coursepulse.service.core.query.TimeSeriesResponse;
import com.coursepulse.service.core.query.UserMetrics;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only metrics views. Access control belongs to the host application; this controller only
 * maps query parameters onto {@link MetricsQueryService}. Mounted under {@code /metrics} so its own
 * traffic is excluded from request metrics.
 */
@RestController
@RequestMapping("/metrics")
@RequiredArgsConstructor
public class MetricsAdminController {

    private final MetricsQueryService queryService;
    private final Clock clock;

    @GetMapping("/dashboard")
    public DashboardMetrics dashboard(
            @RequestParam(required = false) String period,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end) {
        return queryService.getDashboardMetrics(Period.fromValue(period), start, end);
    }

    @GetMapping("/requests")
    public RequestMetrics requests(
            @RequestParam(required = false) String period,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end) {
        TimeRange r = range(period, start, end);
        return queryService.getRequestMetrics(r.start(), r.end());
    }

    @GetMapping("/business")
    public BusinessMetrics business(
            @RequestParam(required = false) String period,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end) {
        TimeRange r = range(period, start, end);
        return queryService.getBusinessMetrics(r.start(), r.end());
    }

    @GetMapping("/users")
    public UserMetrics users(
            @RequestParam(required = false) String period,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end) {
        TimeRange r = range(period, start, end);
        return queryService.getUserMetrics(r.start(), r.end());
    }

    @GetMapping("/courses")
    public CourseMetrics courses(
            @RequestParam(required = false) String period,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end) {
        TimeRange r = range(period, start, end);
        return queryService.getCourseMetrics(r.start(), r.end());
    }

    @GetMapping("/timeseries")
    public TimeSeriesResponse timeseries(
            @RequestParam String metric,
            @RequestParam(required = false) String period,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end,
            @RequestParam(required = false) String granularity) {
        TimeRange r = range(period, start, end);
        return queryService.getTimeseries(metric, r.start(), r.end(), Granularity.fromValue(granularity));
    }

    @GetMapping("/realtime")
    public RealtimeCounters realtime() {
        return queryService.getRealtimeCounters();
    }

    @GetMapping("/summary")
    public MetricsSummary summary() {
        return queryService.getSummary();
    }

    @GetMapping("/health")
    public ResponseEntity<MetricsHealth> health() {
        MetricsHealth health = queryService.getHealth();
        return ResponseEntity.status(health.healthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(health);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(ex.getMessage())));
    }

    private TimeRange range(String period, Instant start, Instant end) {
        Period p = (period == null || period.isBlank()) && start != null && end != null
                ? Period.CUSTOM
                : Period.fromValue(period);
        return p.resolve(clock.instant(), start, end);
    }
}
