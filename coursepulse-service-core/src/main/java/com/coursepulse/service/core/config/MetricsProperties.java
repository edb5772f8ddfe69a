package com.coursepulse.service.core.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "coursepulse.metrics")
public class MetricsProperties {
    private Emitter emitter = new Emitter();
    private Aggregator aggregator = new Aggregator();
    private Cache cache = new Cache();
    private Ingress ingress = new Ingress();
    private Retention retention = new Retention();
    private int dimensionKeyCacheSize = 10000;

    public Emitter getEmitter() {
        return emitter;
    }

    public void setEmitter(Emitter emitter) {
        this.emitter = emitter;
    }

    public Aggregator getAggregator() {
        return aggregator;
    }

    public void setAggregator(Aggregator aggregator) {
        this.aggregator = aggregator;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Ingress getIngress() {
        return ingress;
    }

    public void setIngress(Ingress ingress) {
        this.ingress = ingress;
    }

    public Retention getRetention() {
        return retention;
    }

    public void setRetention(Retention retention) {
        this.retention = retention;
    }

    public int getDimensionKeyCacheSize() {
        return dimensionKeyCacheSize;
    }

    public void setDimensionKeyCacheSize(int dimensionKeyCacheSize) {
        this.dimensionKeyCacheSize = dimensionKeyCacheSize;
    }

    public static class Emitter {
        private boolean enabled = true;
        private int queueCapacity = 10000;
        private int batchSize = 100;
        private Duration flushInterval = Duration.ofSeconds(1);
        private Duration stopTimeout = Duration.ofSeconds(5);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getFlushInterval() {
            return flushInterval;
        }

        public void setFlushInterval(Duration flushInterval) {
            this.flushInterval = flushInterval;
        }

        public Duration getStopTimeout() {
            return stopTimeout;
        }

        public void setStopTimeout(Duration stopTimeout) {
            this.stopTimeout = stopTimeout;
        }
    }

    public static class Aggregator {
        private boolean enabled = true;
        private Duration interval = Duration.ofHours(1);
        private int rollupDelayHours = 2;
        private int backfillDaysOnStart = 0;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public int getRollupDelayHours() {
            return rollupDelayHours;
        }

        public void setRollupDelayHours(int rollupDelayHours) {
            this.rollupDelayHours = rollupDelayHours;
        }

        public int getBackfillDaysOnStart() {
            return backfillDaysOnStart;
        }

        public void setBackfillDaysOnStart(int backfillDaysOnStart) {
            this.backfillDaysOnStart = backfillDaysOnStart;
        }
    }

    public static class Cache {
        private String keyPrefix = "metrics";
        private Duration counterTtl = Duration.ofHours(2);
        private Redis redis = new Redis();

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public Duration getCounterTtl() {
            return counterTtl;
        }

        public void setCounterTtl(Duration counterTtl) {
            this.counterTtl = counterTtl;
        }

        public Redis getRedis() {
            return redis;
        }

        public void setRedis(Redis redis) {
            this.redis = redis;
        }
    }

    public static class Redis {
        private boolean enabled = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Ingress {
        private boolean enabled = true;
        private boolean normalizePaths = true;
        private List<String> excludePaths = new ArrayList<>(List.of(
                "/health",
                "/health/live",
                "/health/ready",
                "/metrics",
                "/docs",
                "/redoc",
                "/openapi.json",
                "/favicon.ico",
                "/actuator"));

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isNormalizePaths() {
            return normalizePaths;
        }

        public void setNormalizePaths(boolean normalizePaths) {
            this.normalizePaths = normalizePaths;
        }

        public List<String> getExcludePaths() {
            return excludePaths;
        }

        public void setExcludePaths(List<String> excludePaths) {
            this.excludePaths = excludePaths;
        }
    }

    public static class Retention {
        private boolean enabled = true;
        private Duration rawEvents = Duration.ofDays(7);
        private Duration hourly = Duration.ofDays(90);
        private Duration daily = Duration.ofDays(730);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getRawEvents() {
            return rawEvents;
        }

        public void setRawEvents(Duration rawEvents) {
            this.rawEvents = rawEvents;
        }

        public Duration getHourly() {
            return hourly;
        }

        public void setHourly(Duration hourly) {
            this.hourly = hourly;
        }

        public Duration getDaily() {
            return daily;
        }

        public void setDaily(Duration daily) {
            this.daily = daily;
        }
    }
}
