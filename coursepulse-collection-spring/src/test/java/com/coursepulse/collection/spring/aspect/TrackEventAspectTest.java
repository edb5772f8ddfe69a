package com.coursepulse.collection.spring.aspect;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.coursepulse.collection.api.annotations.TrackEvent;
import com.coursepulse.collection.api.annotations.TrackedId;
import com.coursepulse.collection.api.extract.BusinessIdExtractor;
import com.coursepulse.collection.api.extract.BusinessIds;
import com.coursepulse.collection.spring.tracker.BusinessEventTracker;
import com.coursepulse.service.core.emitter.MetricsEmitter;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;

class TrackEventAspectTest {

    static final UUID USER = UUID.fromString("11111111-1111-1111-1111-111111111111");
    static final UUID COURSE = UUID.fromString("22222222-2222-2222-2222-222222222222");
    static final UUID LESSON = UUID.fromString("33333333-3333-3333-3333-333333333333");

    record Enrollment(UUID userId, UUID courseId) {}

    public static class EnrollmentExtractor implements BusinessIdExtractor {
        @Override
        public BusinessIds extract(Object[] args, Object result) {
            Enrollment e = (Enrollment) result;
            return new BusinessIds(e.userId(), e.courseId(), null);
        }
    }

    public static class BrokenExtractor implements BusinessIdExtractor {
        @Override
        public BusinessIds extract(Object[] args, Object result) {
            throw new AssertionError("extractor bug");
        }
    }

    public static class CourseService {
        @TrackEvent(value = "enrollment_created", extractor = EnrollmentExtractor.class, includeResult = true)
        public Enrollment enroll(String request) {
            return new Enrollment(USER, COURSE);
        }

        @TrackEvent("lesson_completed")
        public void completeLesson(@TrackedId(TrackedId.Kind.USER) UUID user, @TrackedId(TrackedId.Kind.LESSON) String lesson) {}

        @TrackEvent("course_completed")
        public void failing(@TrackedId(TrackedId.Kind.USER) UUID user) {
            throw new IllegalStateException("nope");
        }

        @TrackEvent(value = "course_viewed", extractor = BrokenExtractor.class)
        public String view(String course) {
            return course;
        }

        @TrackEvent("lesson_started")
        public void badId(@TrackedId(TrackedId.Kind.LESSON) String lesson) {}
    }

    private MetricsEmitter emitter;
    private CourseService proxy;

    @BeforeEach
    void setUp() {
        emitter = mock(MetricsEmitter.class);
        AspectJProxyFactory factory = new AspectJProxyFactory(new CourseService());
        factory.setProxyTargetClass(true);
        factory.addAspect(new TrackEventAspect(new BusinessEventTracker(emitter), null));
        proxy = factory.getProxy();
    }

    @Test
    void ids_come_from_extractor_using_result() {
        proxy.enroll("req");

        verify(emitter).emitBusiness(eq("enrollment_created"), eq(USER), eq(COURSE), isNull(), eq(Map.of()));
    }

    @Test
    void ids_come_from_annotated_parameters() {
        proxy.completeLesson(USER, LESSON.toString());

        verify(emitter).emitBusiness(eq("lesson_completed"), eq(USER), isNull(), eq(LESSON), eq(Map.of()));
    }

    @Test
    void failing_method_propagates_and_emits_nothing() {
        assertThatThrownBy(() -> proxy.failing(USER)).isInstanceOf(IllegalStateException.class);

        verify(emitter, never()).emitBusiness(anyString(), any(), any(), any(), any());
    }

    @Test
    void extraction_failure_is_swallowed() {
        proxy.badId("not-a-uuid");

        verify(emitter, never()).emitBusiness(anyString(), any(), any(), any(), any());
    }

    @Test
    void extractor_error_does_not_reach_caller() {
        assertThat(proxy.view("algebra")).isEqualTo("algebra");

        verify(emitter, never()).emitBusiness(anyString(), any(), any(), any(), any());
    }
}
