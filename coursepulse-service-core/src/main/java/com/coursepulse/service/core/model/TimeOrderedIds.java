package com.coursepulse.service.core.model;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.UUID;

/**
 * Generates version 7 UUIDs: 48-bit Unix millisecond timestamp, 12-bit counter, 62 random bits.
 * Ids from one generator sort by creation order, also within the same millisecond.
 */
public final class TimeOrderedIds {

    private static final TimeOrderedIds SYSTEM = new TimeOrderedIds(Clock.systemUTC());

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();
    private long lastMillis = -1L;
    private int sequence;

    public TimeOrderedIds(Clock clock) {
        this.clock = clock;
    }

    public static UUID next() {
        return SYSTEM.nextId();
    }

    public synchronized UUID nextId() {
        long millis = clock.millis();
        if (millis > lastMillis) {
            lastMillis = millis;
            sequence = random.nextInt(0x400);
        } else {
            sequence++;
            if (sequence > 0xFFF) {
                // counter exhausted within this millisecond; borrow the next one
                lastMillis++;
                sequence = 0;
            }
        }
        long msb = (lastMillis & 0xFFFFFFFFFFFFL) << 16;
        msb |= 0x7000L | (sequence & 0xFFF);
        long lsb = (random.nextLong() & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L;
        return new UUID(msb, lsb);
    }
}
