package com.coursepulse.service.core.model;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Memoizes {@link DimensionKeys#of(Map)} for the small set of dimension maps seen in a batch
 * stream (status groups, methods, normalized paths).
 */
@Slf4j
public class DimensionKeyService {

    private final Cache<String, String> canonicalToKey;

    public DimensionKeyService(long cacheSize) {
        this.canonicalToKey = Caffeine.newBuilder().maximumSize(cacheSize).recordStats().build();
        log.info("Initialized dimension key cache size={}", cacheSize);
    }

    public String keyFor(Map<String, String> dimensions) {
        if (dimensions == null || dimensions.isEmpty()) {
            return DimensionKeys.DEFAULT;
        }
        return canonicalToKey.get(DimensionKeys.canonical(dimensions), DimensionKeys::hash);
    }

    public long cachedKeys() {
        return canonicalToKey.estimatedSize();
    }
}
