package com.ryuqq.fleet.testkit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Mutable clock for deterministic sweep and expiry tests.
 *
 * <p>Every component of the control plane reads time from an injected {@link Clock}, so tests
 * move time forward explicitly instead of sleeping.</p>
 *
 * <pre>
 * TestClock clock = TestClock.at("2025-01-06T10:00:00Z");
 * clock.advance(Duration.ofMinutes(30));
 * </pre>
 *
 * <p>Thread-safe: the current instant is volatile.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TestClock extends Clock {

    public static final Instant DEFAULT_START = Instant.parse("2025-01-06T10:00:00Z");

    private final ZoneId zone;
    private volatile Instant now;

    public TestClock() {
        this(DEFAULT_START, ZoneOffset.UTC);
    }

    public TestClock(Instant start, ZoneId zone) {
        if (start == null || zone == null) {
            throw new IllegalArgumentException("start and zone cannot be null");
        }
        this.now = start;
        this.zone = zone;
    }

    public static TestClock at(String isoInstant) {
        return new TestClock(Instant.parse(isoInstant), ZoneOffset.UTC);
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId newZone) {
        return new TestClock(now, newZone);
    }

    @Override
    public Instant instant() {
        return now;
    }

    /**
     * Moves the clock forward.
     *
     * @param duration non-negative amount to advance
     * @return the new instant
     */
    public Instant advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration must be non-negative (current: " + duration + ")");
        }
        now = now.plus(duration);
        return now;
    }

    public void set(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        now = instant;
    }
}
