package com.questrail.statestore.observability;

/**
 * Receives observability events from a state store.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks may arrive on the dispatch thread, on effect threads and on
 * delivery threads. They must be thread-safe and must not block.</p>
 */
public interface StateStoreObservabilitySink {
    /**
     * Called on the dispatch thread after each committed transition.
     */
    void onTransition(StateTransitionEvent event);

    /**
     * Called when an independently launched effect task starts or settles.
     */
    void onEffectTaskEvent(EffectTaskEvent event);

    /**
     * Called when a subscriber attaches, detaches, or has its feed ended by the store.
     */
    void onSubscriberEvent(SubscriberEvent event);

    /**
     * Called for contained failures (effects, listeners) and for the fatal
     * transition defect.
     */
    void onError(StoreErrorEvent event);
}
