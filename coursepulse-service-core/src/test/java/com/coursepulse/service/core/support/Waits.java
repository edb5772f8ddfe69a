package com.coursepulse.service.core.support;

import java.time.Duration;
import java.util.function.BooleanSupplier;

public final class Waits {

    private Waits() {}

    /** Polls until the condition holds or the timeout elapses; returns the final outcome. */
    public static boolean waitUntil(BooleanSupplier condition, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return condition.getAsBoolean();
            }
        }
        return condition.getAsBoolean();
    }
}
