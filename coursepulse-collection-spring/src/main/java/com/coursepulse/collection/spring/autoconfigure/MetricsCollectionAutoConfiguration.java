package com.coursepulse.collection.spring.autoconfigure;

import com.coursepulse.collection.spring.aspect.TrackEventAspect;
import com.coursepulse.collection.spring.tracker.BusinessEventTracker;
import com.coursepulse.collection.spring.web.MetricsFilter;
import com.coursepulse.service.core.config.MetricsProperties;
import com.coursepulse.service.core.emitter.MetricsEmitter;
import jakarta.servlet.Filter;
import org.springframework.beans.factory.BeanFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.core.Ordered;

/** Wires the HTTP filter, the business event tracker and the {@code @TrackEvent} aspect. */
@AutoConfiguration
@ConditionalOnBean(MetricsEmitter.class)
@EnableAspectJAutoProxy
public class MetricsCollectionAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public BusinessEventTracker businessEventTracker(MetricsEmitter emitter) {
        return new BusinessEventTracker(emitter);
    }

    @Bean
    @ConditionalOnMissingBean
    public TrackEventAspect trackEventAspect(BusinessEventTracker tracker, BeanFactory beanFactory) {
        return new TrackEventAspect(tracker, beanFactory);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(Filter.class)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnProperty(
            prefix = "coursepulse.metrics.ingress",
            name = "enabled",
            havingValue = "true",
            matchIfMissing = true)
    static class ServletIngress {

        @Bean
        @ConditionalOnMissingBean(name = "coursepulseMetricsFilter")
        public FilterRegistrationBean<MetricsFilter> coursepulseMetricsFilter(
                MetricsEmitter emitter, MetricsProperties properties) {
            FilterRegistrationBean<MetricsFilter> reg =
                    new FilterRegistrationBean<>(new MetricsFilter(emitter, properties.getIngress()));
            reg.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
            reg.addUrlPatterns("/*");
            return reg;
        }
    }
}
