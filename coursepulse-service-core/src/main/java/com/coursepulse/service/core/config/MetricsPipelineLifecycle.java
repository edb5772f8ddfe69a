package com.coursepulse.service.core.config;

import com.coursepulse.service.core.aggregator.MetricsAggregator;
import com.coursepulse.service.core.emitter.MetricsEmitter;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

/**
 * Starts the emitter worker and the rollup scheduler once the application is ready and stops them,
 * aggregator first, on shutdown.
 */
@Slf4j
@RequiredArgsConstructor
public class MetricsPipelineLifecycle {

    private final MetricsEmitter emitter;
    private final MetricsAggregator aggregator;
    private final MetricsProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (properties.getEmitter().isEnabled()) {
            emitter.start();
        } else {
            log.info("Metrics emitter disabled");
        }
        MetricsProperties.Aggregator config = properties.getAggregator();
        if (config.getBackfillDaysOnStart() > 0) {
            aggregator.backfill(config.getBackfillDaysOnStart());
        }
        if (config.isEnabled()) {
            aggregator.start(config.getInterval());
        } else {
            log.info("Metrics aggregator disabled");
        }
    }

    @PreDestroy
    public void shutdown() {
        aggregator.stop();
        emitter.stop();
    }
}
