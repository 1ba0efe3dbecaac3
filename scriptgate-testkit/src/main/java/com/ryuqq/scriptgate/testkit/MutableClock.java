package com.ryuqq.scriptgate.testkit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Deterministic clock for tests.
 *
 * <p>Time moves only when the test says so. {@link #advance(Duration)} never goes backwards;
 * {@link #set(Instant)} may jump anywhere.</p>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    private final AtomicReference<Instant> now;
    private final ZoneId zone;

    /**
     * Starts at the given instant in UTC.
     *
     * @param start initial instant
     */
    public MutableClock(Instant start) {
        this(new AtomicReference<>(requireInstant(start)), ZoneOffset.UTC);
    }

    private MutableClock(AtomicReference<Instant> now, ZoneId zone) {
        this.now = now;
        this.zone = zone;
    }

    /**
     * Starts at 2025-01-15T10:00:00Z.
     *
     * @return clock at a fixed well-known instant
     */
    public static MutableClock atDefaultInstant() {
        return new MutableClock(Instant.parse("2025-01-15T10:00:00Z"));
    }

    public void advance(Duration delta) {
        if (delta == null || delta.isNegative()) {
            throw new IllegalArgumentException("Cannot advance clock backwards (delta: " + delta + ")");
        }
        now.updateAndGet(current -> current.plus(delta));
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }

    public void set(Instant instant) {
        now.set(requireInstant(instant));
    }

    @Override
    public Instant instant() {
        return now.get();
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    /**
     * Returns a view in another zone sharing the same time source.
     */
    @Override
    public Clock withZone(ZoneId zone) {
        if (zone == null) {
            throw new IllegalArgumentException("zone cannot be null");
        }
        return new MutableClock(now, zone);
    }

    private static Instant requireInstant(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        return instant;
    }
}
