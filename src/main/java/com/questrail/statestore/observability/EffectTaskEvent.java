package com.questrail.statestore.observability;

import java.time.Instant;

/**
 * Lifecycle step of a launched effect task.
 */
public record EffectTaskEvent(
    Instant timestamp,
    String storeName,
    long taskId,
    Object action,
    Kind kind
) {
    public enum Kind {
        LAUNCHED,
        DISPATCHED,
        NO_ACTION,
        CANCELLED,
        FAILED
    }
}
