package com.quickbite.menuservice.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/** Moves forward by a fixed step on every read. */
class TickingClock extends Clock {

    private Instant current;
    private final Duration step;

    TickingClock(Instant start, Duration step) {
        this.current = start;
        this.step = step;
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        throw new UnsupportedOperationException();
    }

    @Override
    public Instant instant() {
        Instant now = current;
        current = current.plus(step);
        return now;
    }
}
