package com.coursepulse.service.core.model;

import java.util.Locale;

/** Category of a metric event. Stored in lower case. */
public enum EventType {
    REQUEST,
    BUSINESS,
    ERROR;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EventType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Event type must not be blank");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "request" -> REQUEST;
            case "business" -> BUSINESS;
            case "error" -> ERROR;
            default -> throw new IllegalArgumentException("Unsupported event type: " + value);
        };
    }
}
