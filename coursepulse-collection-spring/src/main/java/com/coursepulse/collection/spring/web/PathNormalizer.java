package com.coursepulse.collection.spring.web;

import java.util.regex.Pattern;

/** Collapses id-like path segments to {@code :id} so request metrics group by route. */
public final class PathNormalizer {

    private static final Pattern UUID_SEGMENT =
            Pattern.compile("[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");
    private static final Pattern NUMERIC_SEGMENT = Pattern.compile("/\\d+(?=/|$)");

    private PathNormalizer() {}

    public static String normalize(String path) {
        if (path == null || path.isEmpty()) {
            return path;
        }
        String out = UUID_SEGMENT.matcher(path).replaceAll(":id");
        return NUMERIC_SEGMENT.matcher(out).replaceAll("/:id");
    }
}
