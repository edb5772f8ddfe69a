package com.coursepulse.collection.spring.web;

import com.coursepulse.service.core.config.MetricsProperties;
import com.coursepulse.service.core.emitter.MetricsEmitter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Records one {@code api_request} event per HTTP request: method, normalized path, final status
 * and wall time. Requests that fail downstream are recorded with status 500 before the exception
 * is rethrown.
 */
@Slf4j
public class MetricsFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String REQUEST_ID_ATTRIBUTE = "requestId";
    public static final String USER_ID_ATTRIBUTE = "userId";

    private final MetricsEmitter emitter;
    private final List<String> excludePaths;
    private final boolean normalizePaths;

    public MetricsFilter(MetricsEmitter emitter, MetricsProperties.Ingress config) {
        this.emitter = emitter;
        this.excludePaths = List.copyOf(config.getExcludePaths());
        this.normalizePaths = config.isNormalizePaths();
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        for (String excluded : excludePaths) {
            if (path.equals(excluded) || path.startsWith(excluded + "/")) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        long start = System.nanoTime();
        int status = 500;
        try {
            chain.doFilter(request, response);
            status = response.getStatus();
        } finally {
            double durationMs = (System.nanoTime() - start) / 1_000_000.0;
            record(request, status, durationMs);
        }
    }

    private void record(HttpServletRequest request, int status, double durationMs) {
        try {
            String path = request.getRequestURI();
            emitter.emitRequest(
                    request.getMethod(),
                    normalizePaths ? PathNormalizer.normalize(path) : path,
                    status,
                    durationMs,
                    requestId(request),
                    userId(request));
        } catch (RuntimeException ex) {
            log.debug("Failed to record request metric uri={}", request.getRequestURI(), ex);
        }
    }

    private static String requestId(HttpServletRequest request) {
        String header = request.getHeader(REQUEST_ID_HEADER);
        if (header != null && !header.isBlank()) {
            return header;
        }
        Object attr = request.getAttribute(REQUEST_ID_ATTRIBUTE);
        return attr == null ? null : attr.toString();
    }

    private static UUID userId(HttpServletRequest request) {
        Object attr = request.getAttribute(USER_ID_ATTRIBUTE);
        if (attr instanceof UUID id) {
            return id;
        }
        if (attr instanceof String s && !s.isBlank()) {
            try {
                return UUID.fromString(s);
            } catch (IllegalArgumentException ex) {
                log.debug("Ignoring non-UUID userId attribute {}", s);
            }
        }
        return null;
    }
}
