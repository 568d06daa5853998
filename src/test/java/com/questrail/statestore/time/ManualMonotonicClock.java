package com.questrail.statestore.time;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic clock that moves only when a test calls {@link #advance(Duration)}.
 *
 * <p>The start reading is arbitrary; effects only ever look at differences,
 * so tests can start away from zero to catch code that assumes otherwise.</p>
 */
public final class ManualMonotonicClock implements MonotonicClock {

    private final long origin;
    private final AtomicLong ticks;

    public ManualMonotonicClock() {
        this(Duration.ZERO);
    }

    public ManualMonotonicClock(Duration start) {
        Objects.requireNonNull(start, "start");
        this.origin = start.toNanos();
        this.ticks = new AtomicLong(origin);
    }

    @Override
    public long nowNanos() {
        return ticks.get();
    }

    /** Moves the clock forward by {@code step}; a negative step is rejected. */
    public void advance(Duration step) {
        if (step.isNegative()) {
            throw new IllegalArgumentException("monotonic time cannot go back: " + step);
        }
        ticks.addAndGet(step.toNanos());
    }

    /** Total time advanced since construction. */
    public Duration elapsed() {
        return Duration.ofNanos(ticks.get() - origin);
    }
}
