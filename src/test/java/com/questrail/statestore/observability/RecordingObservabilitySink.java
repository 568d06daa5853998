package com.questrail.statestore.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements StateStoreObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onTransition(StateTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onEffectTaskEvent(EffectTaskEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onSubscriberEvent(SubscriberEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(StoreErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<StateTransitionEvent> getTransitions() {
        return ofType(StateTransitionEvent.class);
    }

    public synchronized List<StoreErrorEvent> getErrors() {
        return ofType(StoreErrorEvent.class);
    }

    public synchronized List<EffectTaskEvent> getEffectTaskEvents() {
        return ofType(EffectTaskEvent.class);
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }

    private <T> List<T> ofType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }
}
