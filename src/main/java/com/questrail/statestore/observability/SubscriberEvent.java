package com.questrail.statestore.observability;

import java.time.Instant;

/**
 * Subscriber registration change.
 *
 * @param token     the subscriber's store-unique token
 * @param remaining number of live subscribers after the change
 */
public record SubscriberEvent(
    Instant timestamp,
    String storeName,
    long token,
    Kind kind,
    int remaining
) {
    public enum Kind {
        SUBSCRIBED,
        UNSUBSCRIBED,
        TERMINATED
    }
}
