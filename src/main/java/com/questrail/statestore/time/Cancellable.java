package com.questrail.statestore.time;

/**
 * Cancellable
 * =============================================================================
 * Minimal cancellation handle shared by scheduled timers and launched effect
 * tasks.
 */
public interface Cancellable
{
    /**
     * Attempt to cancel.
     *
     * @return {@code true} if this call cancelled the work; {@code false} if it
     *         had already run, settled, or been cancelled before.
     */
    boolean cancel();
}
