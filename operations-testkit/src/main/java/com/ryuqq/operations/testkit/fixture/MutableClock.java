package com.ryuqq.operations.testkit.fixture;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Test clock whose current instant is moved explicitly.
 *
 * <p>Registries take a {@link Clock}, so tests control creation and completion times
 * without sleeping.</p>
 *
 * <pre>
 * MutableClock clock = new MutableClock(Instant.parse("2025-01-15T09:30:00Z"));
 * OperationRegistry registry = new InMemoryOperationRegistry(clock);
 * clock.advance(Duration.ofHours(2));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    private final AtomicReference<Instant> now;
    private final ZoneId zone;

    public MutableClock(Instant start) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        this.now = new AtomicReference<>(start);
        this.zone = ZoneOffset.UTC;
    }

    private MutableClock(AtomicReference<Instant> now, ZoneId zone) {
        this.now = now;
        this.zone = zone;
    }

    /**
     * Moves the clock forward.
     *
     * @param duration amount to advance (must not be negative)
     * @return the new current instant
     */
    public Instant advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration must be non-negative, but was: " + duration);
        }
        return now.updateAndGet(current -> current.plus(duration));
    }

    public void setInstant(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        now.set(instant);
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(now, zone);
    }

    @Override
    public Instant instant() {
        return now.get();
    }
}
