package com.questrail.statestore.observability;

/**
 * No-op implementation of StateStoreObservabilitySink.
 */
public final class NullObservabilitySink implements StateStoreObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onTransition(StateTransitionEvent event) {}

    @Override
    public void onEffectTaskEvent(EffectTaskEvent event) {}

    @Override
    public void onSubscriberEvent(SubscriberEvent event) {}

    @Override
    public void onError(StoreErrorEvent event) {}
}
