package com.coursepulse.service.cache.redis;

import com.coursepulse.service.core.cache.RealtimeCounterCache;
import com.coursepulse.service.core.config.MetricsProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/** Registers the Redis realtime counters when {@code coursepulse.metrics.cache.redis.enabled=true}. */
@Configuration
@ConditionalOnClass(StringRedisTemplate.class)
@ConditionalOnProperty(prefix = "coursepulse.metrics.cache.redis", name = "enabled", havingValue = "true")
public class RedisCounterCacheConfig {

    @Bean
    @ConditionalOnMissingBean(RealtimeCounterCache.class)
    public RealtimeCounterCache realtimeCounterCache(StringRedisTemplate redis, MetricsProperties properties) {
        MetricsProperties.Cache cache = properties.getCache();
        return new RedisRealtimeCounterCache(redis, cache.getKeyPrefix(), cache.getCounterTtl());
    }
}
