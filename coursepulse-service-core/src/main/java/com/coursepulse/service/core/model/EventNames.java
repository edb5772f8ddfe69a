package com.coursepulse.service.core.model;

import java.util.Locale;

/** Well-known event and aggregate metric names. */
public final class EventNames {

    // Requests
    public static final String API_REQUEST = "api_request";

    // Users
    public static final String USER_LOGIN = "user_login";
    public static final String USER_LOGOUT = "user_logout";
    public static final String USER_REGISTERED = "user_registered";

    // Courses
    public static final String COURSE_CREATED = "course_created";
    public static final String COURSE_UPDATED = "course_updated";
    public static final String COURSE_PUBLISHED = "course_published";

    // Enrollment and progress
    public static final String ENROLLMENT_CREATED = "enrollment_created";
    public static final String ENROLLMENT_CANCELLED = "enrollment_cancelled";
    public static final String LESSON_STARTED = "lesson_started";
    public static final String LESSON_COMPLETED = "lesson_completed";
    public static final String MODULE_COMPLETED = "module_completed";
    public static final String COURSE_COMPLETED = "course_completed";

    // Social
    public static final String COMMENT_CREATED = "comment_created";
    public static final String COMMENT_DELETED = "comment_deleted";
    public static final String REACTION_ADDED = "reaction_added";

    // Video
    public static final String VIDEO_STARTED = "video_started";
    public static final String VIDEO_COMPLETED = "video_completed";
    public static final String VIDEO_PROGRESS = "video_progress";

    // Derived request breakdowns written by the collector
    public static final String REQUEST_BY_STATUS = "request_by_status";
    public static final String REQUEST_BY_METHOD = "request_by_method";
    public static final String REQUEST_BY_PATH = "request_by_path";

    private EventNames() {}

    public static String error(String errorType) {
        String type = errorType == null || errorType.isBlank() ? "unknown" : errorType.trim();
        return "error_" + type.toLowerCase(Locale.ROOT);
    }

    /** {@code 404 -> "4xx"}. */
    public static String statusGroup(int statusCode) {
        return (statusCode / 100) + "xx";
    }
}
