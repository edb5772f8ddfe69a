package com.coursepulse.collection.api.extract;

import java.util.UUID;

/** Identifiers attached to a business event. Any of them may be {@code null}. */
public record BusinessIds(UUID userId, UUID courseId, UUID lessonId) {

    private static final BusinessIds NONE = new BusinessIds(null, null, null);

    public static BusinessIds none() {
        return NONE;
    }

    public static BusinessIds ofUser(UUID userId) {
        return new BusinessIds(userId, null, null);
    }

    /** Fills ids missing here from {@code other}; ids already present win. */
    public BusinessIds orElse(BusinessIds other) {
        if (other == null) return this;
        return new BusinessIds(
                userId != null ? userId : other.userId,
                courseId != null ? courseId : other.courseId,
                lessonId != null ? lessonId : other.lessonId);
    }

    public boolean isEmpty() {
        return userId == null && courseId == null && lessonId == null;
    }
}
