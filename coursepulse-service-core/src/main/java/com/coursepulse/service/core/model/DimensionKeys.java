package com.coursepulse.service.core.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Stable identifiers for dimension maps.
 *
 * <p>Entries are sorted by key and joined as {@code k=v} pairs separated by {@code |}; the key is
 * the first 16 hex characters of the SHA-256 of that string. An empty or missing map maps to
 * {@value #DEFAULT}.
 */
public final class DimensionKeys {

    public static final String DEFAULT = "default";
    private static final int KEY_LENGTH = 16;

    private DimensionKeys() {}

    public static String of(Map<String, String> dimensions) {
        if (dimensions == null || dimensions.isEmpty()) {
            return DEFAULT;
        }
        return hash(canonical(dimensions));
    }

    static String canonical(Map<String, String> dimensions) {
        return dimensions.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("|"));
    }

    static String hash(String canonical) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashBytes = digest.digest(canonical.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(KEY_LENGTH);
            for (byte b : hashBytes) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) {
                    sb.append('0');
                }
                sb.append(hex);
                if (sb.length() >= KEY_LENGTH) {
                    break;
                }
            }
            return sb.substring(0, KEY_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
