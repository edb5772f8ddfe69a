package com.coursepulse.service.core.store;

@FunctionalInterface
public interface StoreHealthProbe {

    /** Runs a trivial round trip against the store; any exception means unreachable. */
    void ping();
}
