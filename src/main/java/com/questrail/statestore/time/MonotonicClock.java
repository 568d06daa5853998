package com.questrail.statestore.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for delays and timeouts inside effects.
 *
 * <p>Delays MUST be measured against a monotonic source. Wall-clock time is
 * for observability only (see {@link WallClock}).</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Only
     * differences between two readings are meaningful.
     */
    long nowNanos();
}
