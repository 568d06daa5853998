package com.questrail.statestore.api;

/**
 * Registration handle for a {@link StateListener}.
 */
public interface StateSubscription extends AutoCloseable
{
    /**
     * Deregisters the listener and discards undelivered states.
     * Idempotent.
     */
    void cancel();

    /**
     * @return {@code true} until cancelled or until the store terminates the feed
     */
    boolean isActive();

    @Override
    default void close() {
        cancel();
    }
}
