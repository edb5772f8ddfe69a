package com.coursepulse.service.cache.redis;

import com.coursepulse.service.core.cache.RealtimeCounterCache;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Realtime counters stored as plain Redis integers under {@code <prefix>:<hourBucket>:<suffix>}.
 * Every increment refreshes the key's TTL, so an hour's counters disappear once the hour is
 * {@code counterTtl} old. One call to {@link #increment} is sent as a single pipelined
 * MULTI/EXEC, so a counter never exists without its TTL.
 */
@Slf4j
public class RedisRealtimeCounterCache implements RealtimeCounterCache {

    private static final long SCAN_COUNT = 100;

    private final StringRedisTemplate redis;
    private final String keyPrefix;
    private final Duration ttl;

    public RedisRealtimeCounterCache(StringRedisTemplate redis, String keyPrefix, Duration ttl) {
        this.redis = redis;
        this.keyPrefix = keyPrefix;
        this.ttl = ttl;
    }

    @Override
    public void increment(String hourBucket, Map<String, Long> deltasBySuffix) {
        if (deltasBySuffix.isEmpty()) {
            return;
        }
        redis.executePipelined(new SessionCallback<Object>() {
            @Override
            @SuppressWarnings("unchecked")
            public <K, V> Object execute(RedisOperations<K, V> operations) {
                RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                ops.multi();
                for (Map.Entry<String, Long> e : deltasBySuffix.entrySet()) {
                    String key = key(hourBucket, e.getKey());
                    ops.opsForValue().increment(key, e.getValue());
                    ops.expire(key, ttl.toSeconds(), TimeUnit.SECONDS);
                }
                ops.exec();
                return null;
            }
        });
        log.debug("Incremented {} realtime counters for hour {}", deltasBySuffix.size(), hourBucket);
    }

    @Override
    public Map<String, Long> read(String hourBucket) {
        String prefix = key(hourBucket, "");
        TreeSet<String> keys = new TreeSet<>();
        ScanOptions options = ScanOptions.scanOptions().match(prefix + "*").count(SCAN_COUNT).build();
        try (Cursor<String> cursor = redis.scan(options)) {
            while (cursor.hasNext()) {
                keys.add(cursor.next());
            }
        }
        if (keys.isEmpty()) {
            return Map.of();
        }
        List<String> ordered = new ArrayList<>(keys);
        List<String> values = redis.opsForValue().multiGet(ordered);
        Map<String, Long> out = new LinkedHashMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            String raw = values == null ? null : values.get(i);
            if (raw == null) {
                continue; // expired between SCAN and MGET
            }
            out.put(ordered.get(i).substring(prefix.length()), Long.parseLong(raw));
        }
        return out;
    }

    @Override
    public void ping() {
        String pong = redis.execute((RedisCallback<String>) RedisConnection::ping);
        if (!"PONG".equalsIgnoreCase(pong)) {
            throw new IllegalStateException("Unexpected Redis ping reply: " + pong);
        }
    }

    String key(String hourBucket, String suffix) {
        return keyPrefix + ":" + hourBucket + ":" + suffix;
    }
}
