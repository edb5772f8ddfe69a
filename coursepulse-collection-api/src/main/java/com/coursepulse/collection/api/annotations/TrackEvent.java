package com.coursepulse.collection.api.annotations;

import com.coursepulse.collection.api.extract.BusinessIdExtractor;
import java.lang.annotation.*;

/**
 * Emits a business metric event after the annotated method returns normally.
 *
 * <p>Identifiers are taken from parameters annotated with {@link TrackedId} and then from the
 * configured {@link #extractor()}. Failures of the wrapped method propagate unchanged and emit
 * nothing.
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface TrackEvent {

    /** Event name, for example {@code enrollment_created}. */
    String value();

    /** Extractor consulted for ids not supplied through {@link TrackedId} parameters. */
    Class<? extends BusinessIdExtractor> extractor() default BusinessIdExtractor.None.class;

    /** When true the return value is handed to the extractor as well as the arguments. */
    boolean includeResult() default false;
}
