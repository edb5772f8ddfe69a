package com.coursepulse.collection.api.annotations;

import java.lang.annotation.*;

/** Marks a parameter carrying a user, course or lesson id for {@link TrackEvent}. */
@Documented
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
public @interface TrackedId {

    Kind value();

    enum Kind {
        USER,
        COURSE,
        LESSON
    }
}
