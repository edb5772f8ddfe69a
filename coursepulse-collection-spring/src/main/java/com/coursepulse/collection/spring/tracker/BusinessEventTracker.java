package com.coursepulse.collection.spring.tracker;

import com.coursepulse.collection.api.extract.BusinessIds;
import com.coursepulse.service.core.emitter.MetricsEmitter;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Programmatic entry point for business and error events. Never throws into the caller. */
@Slf4j
@RequiredArgsConstructor
public class BusinessEventTracker {

    private final MetricsEmitter emitter;

    public boolean track(String eventName, BusinessIds ids) {
        return track(eventName, ids, Map.of());
    }

    public boolean track(String eventName, BusinessIds ids, Map<String, String> metadata) {
        BusinessIds resolved = ids == null ? BusinessIds.none() : ids;
        try {
            return emitter.emitBusiness(
                    eventName, resolved.userId(), resolved.courseId(), resolved.lessonId(), metadata);
        } catch (RuntimeException ex) {
            log.debug("Failed to track business event {}", eventName, ex);
            return false;
        }
    }

    public boolean trackError(String errorType, String message, String path, UUID userId, String requestId) {
        try {
            return emitter.emitError(errorType, message, path, userId, requestId);
        } catch (RuntimeException ex) {
            log.debug("Failed to track error event type={}", errorType, ex);
            return false;
        }
    }
}
