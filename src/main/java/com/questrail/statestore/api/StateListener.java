package com.questrail.statestore.api;

/**
 * Push-style observer of committed states.
 *
 * <p>Calls for one listener are never concurrent and arrive in transition
 * order. Exceptions thrown from {@link #onState} are contained: they are
 * reported and delivery continues with the next state.</p>
 *
 * @param <S> state type
 */
@FunctionalInterface
public interface StateListener<S>
{
    void onState(S state);

    /**
     * Called once after the last state when the store closes or fails.
     * Not called after the subscriber cancels its own subscription.
     */
    default void onTerminated() {
    }
}
