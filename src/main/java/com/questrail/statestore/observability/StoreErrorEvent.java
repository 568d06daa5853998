package com.questrail.statestore.observability;

import java.time.Instant;

/**
 * A failure observed by the store.
 *
 * <p>{@link Source#TRANSITION} is fatal for the store; every other source is
 * contained and the store keeps running.</p>
 */
public record StoreErrorEvent(
    Instant timestamp,
    String storeName,
    Source source,
    String message,
    Throwable cause
) {
    public enum Source {
        TRANSITION,
        EFFECT,
        EFFECT_TASK,
        SUBSCRIBER
    }

    public boolean isFatal() {
        return source == Source.TRANSITION;
    }
}
