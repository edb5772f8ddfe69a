package com.coursepulse.service.core.query;

import java.util.List;

public record CourseMetrics(
        long totalViews,
        long enrollments,
        long completions,
        double completionRate,
        List<RankedItem> topCourses,
        List<RankedItem> topLessons) {

    public record RankedItem(String id, long count) {}
}
