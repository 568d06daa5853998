package com.questrail.statestore.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * One committed transition.
 *
 * @param sequence 1-based position of this transition in the store's total order
 */
public record StateTransitionEvent(
    Instant timestamp,
    String storeName,
    long sequence,
    Object action,
    Object previousState,
    Object newState
) {
    /**
     * Checks whether the reducer produced a state different from the previous one.
     */
    public boolean isStateChange() {
        return !Objects.equals(previousState, newState);
    }
}
