package com.coursepulse.service.core.config;

import com.coursepulse.service.core.aggregator.MetricsAggregator;
import com.coursepulse.service.core.cache.RealtimeCounterCache;
import com.coursepulse.service.core.collector.MetricsCollector;
import com.coursepulse.service.core.emitter.MetricsEmitter;
import com.coursepulse.service.core.model.DimensionKeyService;
import com.coursepulse.service.core.query.MetricsQueryService;
import com.coursepulse.service.core.store.DailyAggregateRepository;
import com.coursepulse.service.core.store.HourlyAggregateRepository;
import com.coursepulse.service.core.store.MetricsCounterRepository;
import com.coursepulse.service.core.store.MetricsEventRepository;
import com.coursepulse.service.core.store.StoreHealthProbe;
import com.coursepulse.service.core.system.JvmSystemResourceProbe;
import com.coursepulse.service.core.system.SystemResourceProbe;
import java.time.Clock;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/** Wires the emitter, collector, aggregator and query service over the store and cache ports. */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(MetricsProperties.class)
@Import(ClockConfig.class)
public class MetricsPipelineConfiguration {

    @Bean
    public DimensionKeyService dimensionKeyService(MetricsProperties properties) {
        return new DimensionKeyService(properties.getDimensionKeyCacheSize());
    }

    @Bean
    public MetricsCollector metricsCollector(
            MetricsEventRepository eventRepository,
            HourlyAggregateRepository hourlyRepository,
            MetricsCounterRepository counterRepository,
            DimensionKeyService dimensionKeyService) {
        return new MetricsCollector(eventRepository, hourlyRepository, counterRepository, dimensionKeyService);
    }

    @Bean
    public MetricsEmitter metricsEmitter(
            MetricsCollector collector,
            ObjectProvider<RealtimeCounterCache> counterCache,
            MetricsProperties properties,
            Clock clock) {
        return new MetricsEmitter(collector, counterCache.getIfAvailable(), properties.getEmitter(), clock);
    }

    @Bean
    public MetricsAggregator metricsAggregator(
            HourlyAggregateRepository hourlyRepository,
            DailyAggregateRepository dailyRepository,
            MetricsProperties properties,
            Clock clock) {
        return new MetricsAggregator(
                hourlyRepository, dailyRepository, clock, properties.getAggregator().getRollupDelayHours());
    }

    @Bean
    @ConditionalOnMissingBean
    public SystemResourceProbe systemResourceProbe(Clock clock) {
        return new JvmSystemResourceProbe(clock);
    }

    @Bean
    public MetricsQueryService metricsQueryService(
            HourlyAggregateRepository hourlyRepository,
            DailyAggregateRepository dailyRepository,
            MetricsCounterRepository counterRepository,
            StoreHealthProbe storeProbe,
            ObjectProvider<RealtimeCounterCache> counterCache,
            MetricsEmitter emitter,
            SystemResourceProbe systemProbe,
            Clock clock) {
        return new MetricsQueryService(
                hourlyRepository,
                dailyRepository,
                counterRepository,
                storeProbe,
                counterCache.getIfAvailable(),
                emitter,
                systemProbe,
                clock);
    }

    @Bean
    public MetricsPipelineLifecycle metricsPipelineLifecycle(
            MetricsEmitter emitter, MetricsAggregator aggregator, MetricsProperties properties) {
        return new MetricsPipelineLifecycle(emitter, aggregator, properties);
    }
}
