package com.coursepulse.collection.spring.aspect;

import com.coursepulse.collection.api.annotations.TrackEvent;
import com.coursepulse.collection.api.annotations.TrackedId;
import com.coursepulse.collection.api.extract.BusinessIdExtractor;
import com.coursepulse.collection.api.extract.BusinessIds;
import com.coursepulse.collection.spring.tracker.BusinessEventTracker;
import java.lang.annotation.Annotation;
import java.lang.reflect.Method;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.beans.factory.BeanFactory;

/**
 * Emits the business event named by {@link TrackEvent} once the annotated method has returned.
 * Nothing is emitted when the method throws. A failure while extracting ids or tracking never
 * reaches the caller; only a {@link VirtualMachineError} is rethrown.
 */
@Slf4j
@Aspect
public class TrackEventAspect {

    private final BusinessEventTracker tracker;
    private final BeanFactory beanFactory;
    private final Map<Class<? extends BusinessIdExtractor>, BusinessIdExtractor> extractors =
            new ConcurrentHashMap<>();

    /** @param beanFactory source of extractor beans, or {@code null} to always instantiate */
    public TrackEventAspect(BusinessEventTracker tracker, BeanFactory beanFactory) {
        this.tracker = tracker;
        this.beanFactory = beanFactory;
    }

    @Around("@annotation(trackEvent) && execution(* *(..))")
    public Object aroundTracked(ProceedingJoinPoint pjp, TrackEvent trackEvent) throws Throwable {
        Object result = pjp.proceed();
        try {
            BusinessIds ids = fromParameters(pjp);
            if (trackEvent.extractor() != BusinessIdExtractor.None.class) {
                BusinessIds extracted = extractor(trackEvent.extractor())
                        .extract(pjp.getArgs(), trackEvent.includeResult() ? result : null);
                ids = ids.orElse(extracted);
            }
            tracker.track(trackEvent.value(), ids);
        } catch (Throwable ex) {
            if (ex instanceof VirtualMachineError vme) {
                throw vme;
            }
            log.debug("Failed to track {} after {}", trackEvent.value(), pjp.getSignature().toShortString(), ex);
        }
        return result;
    }

    private static BusinessIds fromParameters(ProceedingJoinPoint pjp) {
        Method m = ((MethodSignature) pjp.getSignature()).getMethod();
        Annotation[][] annotations = m.getParameterAnnotations();
        Object[] args = pjp.getArgs();
        UUID user = null;
        UUID course = null;
        UUID lesson = null;
        for (int i = 0; i < annotations.length && i < args.length; i++) {
            for (Annotation a : annotations[i]) {
                if (!(a instanceof TrackedId tracked)) continue;
                UUID id = toUuid(args[i]);
                switch (tracked.value()) {
                    case USER -> user = id;
                    case COURSE -> course = id;
                    case LESSON -> lesson = id;
                }
            }
        }
        return new BusinessIds(user, course, lesson);
    }

    private static UUID toUuid(Object value) {
        if (value == null) return null;
        if (value instanceof UUID id) return id;
        return UUID.fromString(value.toString().trim());
    }

    private BusinessIdExtractor extractor(Class<? extends BusinessIdExtractor> type) {
        return extractors.computeIfAbsent(type, this::resolveExtractor);
    }

    private BusinessIdExtractor resolveExtractor(Class<? extends BusinessIdExtractor> type) {
        if (beanFactory != null) {
            BusinessIdExtractor bean = beanFactory.getBeanProvider(type).getIfAvailable();
            if (bean != null) {
                return bean;
            }
        }
        try {
            return type.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot instantiate extractor " + type.getName(), e);
        }
    }
}
