package com.coursepulse.collection.api.extract;

/**
 * Derives business ids from an invocation of a {@code @TrackEvent} method.
 *
 * <p>Implementations should be side-effect free; any exception they throw is logged and the
 * event is emitted with whatever ids were already known.
 */
@FunctionalInterface
public interface BusinessIdExtractor {

    /**
     * @param args   the invocation arguments, never {@code null}
     * @param result the return value when {@code includeResult} is set, otherwise {@code null}
     */
    BusinessIds extract(Object[] args, Object result);

    /** Default extractor that contributes nothing. */
    final class None implements BusinessIdExtractor {
        @Override
        public BusinessIds extract(Object[] args, Object result) {
            return BusinessIds.none();
        }
    }
}
