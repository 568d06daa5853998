package com.questrail.statestore.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Timer surface used by delayed effects (debounce, retry spacing, simulated
 * latency).
 *
 * <p>Deadlines are monotonic nanoseconds taken from a {@link MonotonicClock},
 * never wall-clock instants.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos deadline in nanoseconds, as read from {@link MonotonicClock#nowNanos()}
     * @param task          the task
     * @return a handle that prevents the task from running if cancelled in time
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedule a task {@code delay} after the clock's current reading.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        return scheduleAtNanos(clock.nowNanos() + delay.toNanos(), task);
    }
}
