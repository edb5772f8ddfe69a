package com.coursepulse.service.storage.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.Map;

/** Encodes string maps for {@code jsonb} columns with keys in sorted order. */
final class JsonColumns {
    private static final ObjectMapper M =
            new ObjectMapper().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};

    private JsonColumns() {}

    static String toJson(Map<String, String> map) {
        if (map == null || map.isEmpty()) {
            return "{}";
        }
        try {
            return M.writeValueAsString(map);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("JSON encode failed", e);
        }
    }

    static Map<String, String> toMap(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return M.readValue(json, STRING_MAP);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("JSON decode failed", e);
        }
    }
}
